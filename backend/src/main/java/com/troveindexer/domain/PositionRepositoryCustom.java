package com.troveindexer.domain;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * MongoTemplate-backed operations that Spring Data derivation cannot express.
 */
public interface PositionRepositoryCustom {

    /**
     * Most recent record (highest positionId) for (wallet, asset) whose status is in {@code statuses}.
     */
    Optional<Position> findLatest(String walletAddress, String asset, Collection<PositionStatus> statuses);

    /**
     * The position whose history already holds an entry from (txHash, logIndex), if any.
     */
    Optional<Position> findByHistoryEntry(String txHash, long logIndex);

    /**
     * Atomically sets the mutable fields and pushes {@code entry} onto history, unless the document
     * already carries an entry from the same (txHash, logIndex).
     *
     * @return true when the document was modified
     */
    boolean applyUpdate(long positionId, BigDecimal collateral, BigDecimal debt, BigDecimal healthRatio,
                        PositionStatus status, long blockNumber, HistoryEntry entry);

    List<Position> search(String walletAddress, String asset, PositionStatus status);
}
