package com.troveindexer.ingestion.position;

import com.troveindexer.domain.HistoryEntry;
import com.troveindexer.domain.Position;
import com.troveindexer.domain.PositionStatus;

import java.util.Optional;
import java.util.Set;

/**
 * Durable store of positions keyed on logical identity. Both write paths are idempotent per source log
 * (txHash, logIndex), so replaying a batch after a crash does not duplicate history.
 */
public interface PositionGateway {

    /**
     * One greater than the highest assigned identity, or 1 when none exists. Read-then-use: single writer only.
     */
    long nextIdentity();

    /**
     * Creates a new position. Returns the existing record when the opening log was already applied.
     *
     * @throws DuplicateIdentityException when positionId is already taken by another lifecycle
     * @throws PersistenceException       on any other store failure
     */
    Position insert(Position position);

    /**
     * Replaces the mutable fields of the most recent record for (wallet, asset) whose status is in
     * {@code statusFilter} and appends {@code entry}, atomically.
     *
     * @return false when that record already holds an entry from the same source log
     * @throws PositionNotFoundException when nothing matches
     */
    boolean updateLatest(String walletAddress, String asset, Set<PositionStatus> statusFilter,
                         PositionState newState, HistoryEntry entry);

    /** Most recent record for the pair regardless of status. */
    Optional<Position> findLatest(String walletAddress, String asset);

    /** The position that already absorbed the given source log, if any. */
    Optional<Position> findByHistoryEntry(String txHash, long logIndex);
}
