package com.troveindexer.ingestion.store;

import com.troveindexer.domain.HistoryEntry;
import com.troveindexer.domain.Position;
import com.troveindexer.domain.PositionRepository;
import com.troveindexer.domain.PositionStatus;
import com.troveindexer.ingestion.position.DuplicateIdentityException;
import com.troveindexer.ingestion.position.PersistenceException;
import com.troveindexer.ingestion.position.PositionGateway;
import com.troveindexer.ingestion.position.PositionNotFoundException;
import com.troveindexer.ingestion.position.PositionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Position gateway on the positions collection. Identity is client-side max-plus-one behind a unique index,
 * so a concurrent writer surfaces as {@link DuplicateIdentityException} instead of a silent duplicate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MongoPositionGateway implements PositionGateway {

    private final PositionRepository repository;

    @Override
    public long nextIdentity() {
        return store("nextIdentity", () -> repository.findTopByOrderByPositionIdDesc()
                .map(p -> p.getPositionId() + 1)
                .orElse(1L));
    }

    @Override
    public Position insert(Position position) {
        if (!position.getHistory().isEmpty()) {
            HistoryEntry opening = position.getHistory().get(0);
            Optional<Position> existing = findByHistoryEntry(opening.txHash(), opening.logIndex());
            if (existing.isPresent()) {
                log.debug("Opening log {}:{} already produced position {}",
                        opening.txHash(), opening.logIndex(), existing.get().getPositionId());
                return existing.get();
            }
        }
        try {
            return repository.insert(position);
        } catch (DuplicateKeyException e) {
            throw new DuplicateIdentityException(position.getPositionId(), e);
        } catch (DataAccessException e) {
            throw new PersistenceException("insert position " + position.getPositionId() + " failed", e);
        }
    }

    @Override
    public boolean updateLatest(String walletAddress, String asset, Set<PositionStatus> statusFilter,
                                PositionState newState, HistoryEntry entry) {
        Position target = store("findLatest", () -> repository.findLatest(walletAddress, asset, statusFilter))
                .orElseThrow(() -> new PositionNotFoundException(walletAddress, asset));
        return store("applyUpdate", () -> repository.applyUpdate(
                target.getPositionId(),
                newState.collateral(),
                newState.debt(),
                newState.healthRatio(),
                newState.status(),
                newState.blockNumber(),
                entry));
    }

    @Override
    public Optional<Position> findLatest(String walletAddress, String asset) {
        return store("findLatest", () -> repository.findTopByWalletAddressAndAssetOrderByPositionIdDesc(walletAddress, asset));
    }

    @Override
    public Optional<Position> findByHistoryEntry(String txHash, long logIndex) {
        return store("findByHistoryEntry", () -> repository.findByHistoryEntry(txHash, logIndex));
    }

    private static <T> T store(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new PersistenceException(operation + " failed", e);
        }
    }
}
