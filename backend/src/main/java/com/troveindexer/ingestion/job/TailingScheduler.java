package com.troveindexer.ingestion.job;

import com.troveindexer.config.AsyncConfig;
import com.troveindexer.ingestion.adapter.LedgerClient;
import com.troveindexer.ingestion.adapter.RawLog;
import com.troveindexer.ingestion.adapter.TransientFetchException;
import com.troveindexer.ingestion.config.TailingProperties;
import com.troveindexer.ingestion.config.WatchedContractsProperties;
import com.troveindexer.ingestion.pipeline.BatchProcessor;
import com.troveindexer.ingestion.pipeline.BatchResult;
import com.troveindexer.ingestion.position.DuplicateIdentityException;
import com.troveindexer.ingestion.position.PersistenceException;
import com.troveindexer.ingestion.store.CursorStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tailing loop: reads the chain head, processes {@code [next, min(next + batchSize - 1, head)]}, checkpoints
 * the cursor, repeats. Caught up means IDLE and a poll-interval pause; a transient fetch or store failure
 * leaves the cursor where it is and retries the same range after the retry interval, forever.
 *
 * <p>Runs on the single {@link AsyncConfig#INDEXER_EXECUTOR} thread. {@link #step()} is one iteration and
 * is what tests drive.
 */
@Component
@Slf4j
public class TailingScheduler {

    private final LedgerClient ledgerClient;
    private final BatchProcessor batchProcessor;
    private final CursorStore cursorStore;
    private final TailingProperties tailingProperties;
    private final WatchedContractsProperties watchedContracts;
    private final Executor indexerExecutor;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean running;
    private volatile IndexerState state = IndexerState.STOPPED;
    /** Last checkpointed block; null until loaded from the store or first batch. */
    private volatile Long lastProcessedBlock;
    private volatile boolean cursorLoaded;
    private volatile Long lastHead;
    private volatile Instant lastBatchAt;
    private volatile String lastError;

    public TailingScheduler(
            LedgerClient ledgerClient,
            BatchProcessor batchProcessor,
            CursorStore cursorStore,
            TailingProperties tailingProperties,
            WatchedContractsProperties watchedContracts,
            @Qualifier(AsyncConfig.INDEXER_EXECUTOR) Executor indexerExecutor,
            Clock clock
    ) {
        this.ledgerClient = ledgerClient;
        this.batchProcessor = batchProcessor;
        this.cursorStore = cursorStore;
        this.tailingProperties = tailingProperties;
        this.watchedContracts = watchedContracts;
        this.indexerExecutor = indexerExecutor;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!tailingProperties.isEnabled()) {
            log.info("Tailing disabled (troveindexer.ingestion.tailing.enabled=false)");
            return;
        }
        start();
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        running = true;
        indexerExecutor.execute(this::runLoop);
        log.info("Tailing loop started: contracts={} batchSize={} startBlock={}",
                watchedContracts.addresses(), tailingProperties.getBatchSize(), tailingProperties.getStartBlock());
    }

    @PreDestroy
    public void stop() {
        running = false;
    }

    void runLoop() {
        while (running) {
            StepOutcome outcome = step();
            long pauseMs = switch (outcome) {
                case ADVANCED -> 0L;
                case IDLE -> tailingProperties.getPollIntervalMs();
                case RETRY -> tailingProperties.getRetryIntervalMs();
                case HALTED -> -1L;
            };
            if (pauseMs < 0) {
                break;
            }
            if (pauseMs > 0 && !pause(pauseMs)) {
                break;
            }
        }
        running = false;
        log.info("Tailing loop exited in state {}", state);
    }

    /**
     * One iteration of the loop. Never throws for fetch or store failures; those become {@link StepOutcome#RETRY}.
     */
    public StepOutcome step() {
        if (state == IndexerState.HALTED) {
            return StepOutcome.HALTED;
        }
        long next;
        long head;
        try {
            next = nextBlock();
            head = ledgerClient.currentHead();
        } catch (TransientFetchException e) {
            return retry("Head query failed", e);
        } catch (PersistenceException e) {
            return retry("Cursor load failed", e);
        }
        lastHead = head;
        if (next > head) {
            transitionTo(IndexerState.IDLE);
            return StepOutcome.IDLE;
        }
        transitionTo(IndexerState.CATCHING_UP);
        long to = Math.min(next + tailingProperties.getBatchSize() - 1, head);
        try {
            List<RawLog> logs = ledgerClient.queryLogs(next, to, watchedContracts.addresses());
            BatchResult result = batchProcessor.process(logs);
            cursorStore.save(tailingProperties.getCursorId(), to);
            lastProcessedBlock = to;
            lastBatchAt = Instant.now(clock);
            lastError = null;
            log.info("Processed blocks [{}-{}] head={}: logs={} decoded={} folded={} skipped={}",
                    next, to, head, result.logs(), result.decoded(), result.folded(), result.skipped());
            return StepOutcome.ADVANCED;
        } catch (TransientFetchException e) {
            return retry("Fetch [" + next + "-" + to + "] failed", e);
        } catch (PersistenceException e) {
            return retry("Persisting batch [" + next + "-" + to + "] failed", e);
        } catch (DuplicateIdentityException e) {
            log.error("Halting indexer at batch [{}-{}]: {}", next, to, e.getMessage(), e);
            lastError = e.getMessage();
            transitionTo(IndexerState.HALTED);
            return StepOutcome.HALTED;
        }
    }

    public IndexerStatus status() {
        long next = lastProcessedBlock != null ? lastProcessedBlock + 1 : tailingProperties.getStartBlock();
        return new IndexerStatus(state, lastProcessedBlock, next, lastHead, lastBatchAt, lastError);
    }

    private long nextBlock() {
        if (!cursorLoaded) {
            OptionalLong checkpoint = cursorStore.load(tailingProperties.getCursorId());
            if (checkpoint.isPresent()) {
                lastProcessedBlock = checkpoint.getAsLong();
                log.info("Resuming from checkpoint: last processed block {}", lastProcessedBlock);
            } else {
                log.info("No checkpoint found; starting at block {}", tailingProperties.getStartBlock());
            }
            cursorLoaded = true;
        }
        Long last = lastProcessedBlock;
        return last != null ? last + 1 : tailingProperties.getStartBlock();
    }

    private StepOutcome retry(String what, RuntimeException e) {
        lastError = e.getMessage();
        if (e instanceof PersistenceException) {
            log.error("{}; retrying in {} ms: {}", what, tailingProperties.getRetryIntervalMs(), e.getMessage(), e);
        } else {
            log.warn("{}; retrying in {} ms: {}", what, tailingProperties.getRetryIntervalMs(), e.getMessage());
        }
        return StepOutcome.RETRY;
    }

    private void transitionTo(IndexerState target) {
        IndexerState previous = state;
        if (previous != target) {
            state = target;
            log.info("Indexer state {} -> {}", previous, target);
        }
    }

    private boolean pause(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Tailing loop interrupted");
            return false;
        }
    }
}
