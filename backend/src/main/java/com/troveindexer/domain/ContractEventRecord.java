package com.troveindexer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Raw audit trail: one document per decoded contract log, any event name. Append-only; never updated.
 */
@Document(collection = "contract_events")
@CompoundIndex(name = "txHash_logIndex", def = "{'txHash': 1, 'logIndex': 1}", unique = true)
@CompoundIndex(name = "contract_block", def = "{'contractAddress': 1, 'blockNumber': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ContractEventRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String eventName;
    private String contractAddress;
    private String txHash;
    private long logIndex;
    private long blockNumber;
    /** Decoded non-indexed fields by ABI name; uint values stored as decimal strings. */
    private org.bson.Document decodedData;
    private Instant recordedAt;
}
