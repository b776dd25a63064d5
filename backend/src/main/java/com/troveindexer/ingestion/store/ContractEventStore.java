package com.troveindexer.ingestion.store;

import com.troveindexer.domain.ContractEventRecord;
import com.troveindexer.domain.ContractEventRecordRepository;
import com.troveindexer.domain.DomainEvent;
import com.troveindexer.domain.LogMeta;
import com.troveindexer.ingestion.position.PersistenceException;
import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Appends decoded events to contract_events keyed by (txHash, logIndex). Writing the same log twice returns
 * the first record.
 */
@Service
@RequiredArgsConstructor
public class ContractEventStore {

    private final ContractEventRecordRepository repository;
    private final Clock clock;

    public ContractEventRecord record(DomainEvent event) {
        LogMeta meta = event.meta();
        try {
            return repository.findByTxHashAndLogIndex(meta.txHash(), meta.logIndex())
                    .orElseGet(() -> insert(event));
        } catch (DuplicateKeyException e) {
            return repository.findByTxHashAndLogIndex(meta.txHash(), meta.logIndex())
                    .orElseThrow(() -> new PersistenceException("contract event " + meta.txHash() + ":" + meta.logIndex()
                            + " reported duplicate but not found", e));
        } catch (DataAccessException e) {
            throw new PersistenceException("record contract event " + meta.txHash() + ":" + meta.logIndex() + " failed", e);
        }
    }

    private ContractEventRecord insert(DomainEvent event) {
        LogMeta meta = event.meta();
        ContractEventRecord record = new ContractEventRecord();
        record.setEventName(event.name());
        record.setContractAddress(meta.contractAddress());
        record.setTxHash(meta.txHash());
        record.setLogIndex(meta.logIndex());
        record.setBlockNumber(meta.blockNumber());
        record.setDecodedData(toDocument(event.auditFields()));
        record.setRecordedAt(Instant.now(clock));
        return repository.insert(record);
    }

    static Document toDocument(Map<String, Object> fields) {
        Document doc = new Document();
        fields.forEach((name, value) -> doc.append(name, value instanceof BigInteger b ? b.toString() : value));
        return doc;
    }
}
