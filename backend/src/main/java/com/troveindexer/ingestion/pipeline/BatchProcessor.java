package com.troveindexer.ingestion.pipeline;

import com.troveindexer.domain.DomainEvent;
import com.troveindexer.domain.TroveUpdatedEvent;
import com.troveindexer.ingestion.adapter.RawLog;
import com.troveindexer.ingestion.decoder.LogEventDecoder;
import com.troveindexer.ingestion.decoder.PayloadDecodeException;
import com.troveindexer.ingestion.position.FoldOutcome;
import com.troveindexer.ingestion.position.LifecycleException;
import com.troveindexer.ingestion.position.PositionStateFolder;
import com.troveindexer.ingestion.store.ContractEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decode, audit and fold one batch of logs strictly in ledger order. A bad payload or a lifecycle
 * rejection drops that one log; store failures and identity collisions abort the batch so the caller
 * can retry or halt without advancing the cursor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchProcessor {

    private final LogEventDecoder decoder;
    private final ContractEventStore contractEventStore;
    private final PositionStateFolder positionStateFolder;

    public BatchResult process(List<RawLog> logs) {
        if (logs.isEmpty()) {
            return BatchResult.EMPTY;
        }
        List<RawLog> ordered = new ArrayList<>(logs);
        ordered.sort(RawLog.LEDGER_ORDER);

        int decoded = 0;
        int folded = 0;
        int skipped = 0;
        for (RawLog rawLog : ordered) {
            Optional<DomainEvent> event;
            try {
                event = decoder.decode(rawLog);
            } catch (PayloadDecodeException e) {
                log.warn("Skipping log {}:{} block {}: {}", rawLog.txHash(), rawLog.logIndex(),
                        rawLog.blockNumber(), e.getMessage());
                skipped++;
                continue;
            }
            if (event.isEmpty()) {
                continue;
            }
            decoded++;
            contractEventStore.record(event.get());
            if (event.get() instanceof TroveUpdatedEvent troveUpdated) {
                try {
                    FoldOutcome outcome = positionStateFolder.fold(troveUpdated);
                    if (outcome != FoldOutcome.REPLAYED) {
                        folded++;
                    }
                } catch (LifecycleException e) {
                    log.warn("Dropping TroveUpdated {}:{} block {}: {}", rawLog.txHash(), rawLog.logIndex(),
                            rawLog.blockNumber(), e.getMessage());
                    skipped++;
                }
            }
        }
        return new BatchResult(ordered.size(), decoded, folded, skipped);
    }
}
