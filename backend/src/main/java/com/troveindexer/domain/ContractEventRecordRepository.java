package com.troveindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for contract_events.
 */
public interface ContractEventRecordRepository extends MongoRepository<ContractEventRecord, String> {

    Optional<ContractEventRecord> findByTxHashAndLogIndex(String txHash, long logIndex);

    List<ContractEventRecord> findByTxHash(String txHash);
}
