package com.troveindexer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Materialized state of one (wallet, asset) trove lifecycle. Current collateral/debt always mirror the
 * last history entry; history is append-only. positionId is assigned once at open and never reused.
 */
@Document(collection = "positions")
@CompoundIndex(name = "wallet_asset_positionId", def = "{'walletAddress': 1, 'asset': 1, 'positionId': -1}")
@CompoundIndex(name = "history_tx_log", def = "{'history.txHash': 1, 'history.logIndex': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Position {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private long positionId;
    private String walletAddress;
    private String asset;
    private BigDecimal collateral;
    private BigDecimal debt;
    /** Debt / collateral in percent, 2 decimals; 0 when collateral is 0. */
    private BigDecimal healthRatio;
    private PositionStatus status;
    private long blockNumber;
    private List<HistoryEntry> history = new ArrayList<>();

    public void setHistory(List<HistoryEntry> history) {
        this.history = history != null ? history : new ArrayList<>();
    }

    public boolean containsEntryFrom(String txHash, long logIndex) {
        return history.stream().anyMatch(h -> h.isFrom(txHash, logIndex));
    }
}
