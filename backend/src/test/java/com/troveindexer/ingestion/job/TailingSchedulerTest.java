package com.troveindexer.ingestion.job;

import com.troveindexer.ingestion.adapter.LedgerClient;
import com.troveindexer.ingestion.adapter.TransientFetchException;
import com.troveindexer.ingestion.config.TailingProperties;
import com.troveindexer.ingestion.config.WatchedContractsProperties;
import com.troveindexer.ingestion.config.WatchedContractsProperties.WatchedContract;
import com.troveindexer.ingestion.pipeline.BatchProcessor;
import com.troveindexer.ingestion.pipeline.BatchResult;
import com.troveindexer.ingestion.position.DuplicateIdentityException;
import com.troveindexer.ingestion.position.PersistenceException;
import com.troveindexer.ingestion.store.CursorStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TailingSchedulerTest {

    private static final String CURSOR = "test-cursor";
    private static final List<String> CONTRACTS = List.of("0xe5d2644be06c5b5d48b42aa7f9eaf27f0bc84265");

    @Mock
    LedgerClient ledgerClient;
    @Mock
    BatchProcessor batchProcessor;
    @Mock
    CursorStore cursorStore;

    private TailingScheduler scheduler;

    @BeforeEach
    void setUp() {
        TailingProperties tailing = new TailingProperties();
        tailing.setStartBlock(1000L);
        tailing.setBatchSize(500);
        tailing.setCursorId(CURSOR);
        WatchedContract troveManager = new WatchedContract();
        troveManager.setName("TroveManager");
        troveManager.setAddress("0xE5d2644bE06c5b5d48b42AA7f9EAf27f0bC84265");
        troveManager.setAbi("classpath:abi/TroveManager.json");
        WatchedContractsProperties contracts = new WatchedContractsProperties();
        contracts.setContracts(List.of(troveManager));
        scheduler = new TailingScheduler(ledgerClient, batchProcessor, cursorStore, tailing, contracts,
                Runnable::run, Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void noCheckpoint_startsAtConfiguredBlock_andCheckpointsBatchEnd() {
        when(cursorStore.load(CURSOR)).thenReturn(OptionalLong.empty());
        when(ledgerClient.currentHead()).thenReturn(5000L);
        when(ledgerClient.queryLogs(1000L, 1499L, CONTRACTS)).thenReturn(List.of());
        when(batchProcessor.process(List.of())).thenReturn(BatchResult.EMPTY);

        assertThat(scheduler.step()).isEqualTo(StepOutcome.ADVANCED);

        verify(cursorStore).save(CURSOR, 1499L);
        assertThat(scheduler.status().state()).isEqualTo(IndexerState.CATCHING_UP);
        assertThat(scheduler.status().lastProcessedBlock()).isEqualTo(1499L);
        assertThat(scheduler.status().nextBlock()).isEqualTo(1500L);
        assertThat(scheduler.status().lastHead()).isEqualTo(5000L);
    }

    @Test
    void checkpoint_resumesFromNextBlock_andLoadsOnlyOnce() {
        when(cursorStore.load(CURSOR)).thenReturn(OptionalLong.of(2999L));
        when(ledgerClient.currentHead()).thenReturn(10_000L);
        when(ledgerClient.queryLogs(anyLong(), anyLong(), anyList())).thenReturn(List.of());
        when(batchProcessor.process(List.of())).thenReturn(BatchResult.EMPTY);

        scheduler.step();
        scheduler.step();

        verify(ledgerClient).queryLogs(3000L, 3499L, CONTRACTS);
        verify(ledgerClient).queryLogs(3500L, 3999L, CONTRACTS);
        verify(cursorStore, times(1)).load(CURSOR);
    }

    @Test
    void lastBatch_isCappedAtHead() {
        when(cursorStore.load(CURSOR)).thenReturn(OptionalLong.empty());
        when(ledgerClient.currentHead()).thenReturn(1200L);
        when(ledgerClient.queryLogs(1000L, 1200L, CONTRACTS)).thenReturn(List.of());
        when(batchProcessor.process(List.of())).thenReturn(BatchResult.EMPTY);

        scheduler.step();

        verify(cursorStore).save(CURSOR, 1200L);
    }

    @Test
    void cursorPastHead_goesIdleWithoutFetching() {
        when(cursorStore.load(CURSOR)).thenReturn(OptionalLong.of(1200L));
        when(ledgerClient.currentHead()).thenReturn(1200L);

        assertThat(scheduler.step()).isEqualTo(StepOutcome.IDLE);

        assertThat(scheduler.status().state()).isEqualTo(IndexerState.IDLE);
        verify(ledgerClient, never()).queryLogs(anyLong(), anyLong(), anyList());
        verifyNoInteractions(batchProcessor);
    }

    @Test
    void idle_resumesCatchingUpWhenHeadAdvances() {
        when(cursorStore.load(CURSOR)).thenReturn(OptionalLong.of(1200L));
        when(ledgerClient.currentHead()).thenReturn(1200L, 1203L);
        when(ledgerClient.queryLogs(1201L, 1203L, CONTRACTS)).thenReturn(List.of());
        when(batchProcessor.process(List.of())).thenReturn(BatchResult.EMPTY);

        assertThat(scheduler.step()).isEqualTo(StepOutcome.IDLE);
        assertThat(scheduler.step()).isEqualTo(StepOutcome.ADVANCED);

        assertThat(scheduler.status().state()).isEqualTo(IndexerState.CATCHING_UP);
        verify(cursorStore).save(CURSOR, 1203L);
    }

    @Test
    void transientFetchFailure_retriesSameRangeWithoutAdvancing() {
        when(cursorStore.load(CURSOR)).thenReturn(OptionalLong.empty());
        when(ledgerClient.currentHead()).thenReturn(5000L);
        when(ledgerClient.queryLogs(1000L, 1499L, CONTRACTS))
                .thenThrow(new TransientFetchException("eth_getLogs failed after 3 attempts", null))
                .thenReturn(List.of());
        when(batchProcessor.process(List.of())).thenReturn(BatchResult.EMPTY);

        assertThat(scheduler.step()).isEqualTo(StepOutcome.RETRY);
        verify(cursorStore, never()).save(anyString(), anyLong());
        assertThat(scheduler.status().lastError()).contains("failed after 3 attempts");

        assertThat(scheduler.step()).isEqualTo(StepOutcome.ADVANCED);
        verify(ledgerClient, times(2)).queryLogs(1000L, 1499L, CONTRACTS);
        verify(cursorStore).save(CURSOR, 1499L);
    }

    @Test
    void headQueryFailure_isRetried() {
        when(cursorStore.load(CURSOR)).thenReturn(OptionalLong.empty());
        when(ledgerClient.currentHead()).thenThrow(new TransientFetchException("eth_blockNumber failed", null));

        assertThat(scheduler.step()).isEqualTo(StepOutcome.RETRY);
        verify(ledgerClient, never()).queryLogs(anyLong(), anyLong(), anyList());
    }

    @Test
    void persistenceFailure_retriesWholeBatch() {
        when(cursorStore.load(CURSOR)).thenReturn(OptionalLong.empty());
        when(ledgerClient.currentHead()).thenReturn(5000L);
        when(ledgerClient.queryLogs(1000L, 1499L, CONTRACTS)).thenReturn(List.of());
        when(batchProcessor.process(List.of())).thenThrow(new PersistenceException("write failed", null));

        assertThat(scheduler.step()).isEqualTo(StepOutcome.RETRY);

        verify(cursorStore, never()).save(anyString(), anyLong());
        assertThat(scheduler.status().nextBlock()).isEqualTo(1000L);
    }

    @Test
    void duplicateIdentity_haltsForGood() {
        when(cursorStore.load(CURSOR)).thenReturn(OptionalLong.empty());
        when(ledgerClient.currentHead()).thenReturn(5000L);
        when(ledgerClient.queryLogs(1000L, 1499L, CONTRACTS)).thenReturn(List.of());
        when(batchProcessor.process(List.of())).thenThrow(new DuplicateIdentityException(4L, null));

        assertThat(scheduler.step()).isEqualTo(StepOutcome.HALTED);
        assertThat(scheduler.step()).isEqualTo(StepOutcome.HALTED);

        assertThat(scheduler.status().state()).isEqualTo(IndexerState.HALTED);
        verify(ledgerClient, times(1)).currentHead();
        verify(cursorStore, never()).save(anyString(), anyLong());
    }

    @Test
    void status_beforeFirstStep_reportsStartBlock() {
        IndexerStatus status = scheduler.status();

        assertThat(status.state()).isEqualTo(IndexerState.STOPPED);
        assertThat(status.lastProcessedBlock()).isNull();
        assertThat(status.nextBlock()).isEqualTo(1000L);
        assertThat(status.lastHead()).isNull();
    }

    @Test
    void runLoop_exitsWhenHalted() {
        when(cursorStore.load(CURSOR)).thenReturn(OptionalLong.empty());
        when(ledgerClient.currentHead()).thenReturn(5000L);
        when(ledgerClient.queryLogs(eq(1000L), eq(1499L), anyList())).thenReturn(List.of());
        when(batchProcessor.process(List.of())).thenThrow(new DuplicateIdentityException(1L, null));

        scheduler.start();

        assertThat(scheduler.status().state()).isEqualTo(IndexerState.HALTED);
    }
}
