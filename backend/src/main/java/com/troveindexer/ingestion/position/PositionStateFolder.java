package com.troveindexer.ingestion.position;

import com.troveindexer.domain.HistoryEntry;
import com.troveindexer.domain.LifecycleOperation;
import com.troveindexer.domain.LogMeta;
import com.troveindexer.domain.Position;
import com.troveindexer.domain.PositionStatus;
import com.troveindexer.domain.TroveUpdatedEvent;
import com.troveindexer.ingestion.decoder.AbiWords;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Folds TroveUpdated events into position state: Opened inserts a new position with the next identity,
 * every other operation updates the most recent record for (wallet, asset) and appends a history entry.
 *
 * <p>Status after an update: Closed → closed; otherwise debt exactly 0 → liquidated; otherwise active.
 * Terminal records are never updated; the event is rejected with {@link PositionTerminatedException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PositionStateFolder {

    private final PositionGateway gateway;
    private final DecimalScaleResolver decimalScaleResolver;
    private final Clock clock;

    /**
     * @throws LifecycleException          when the event does not fit the current lifecycle (reported, dropped)
     * @throws DuplicateIdentityException  on an identity collision
     * @throws PersistenceException        on store failure
     */
    public FoldOutcome fold(TroveUpdatedEvent event) {
        PositionObservation observation = observe(event);
        LogMeta meta = event.meta();
        Optional<Position> alreadyApplied = gateway.findByHistoryEntry(meta.txHash(), meta.logIndex());
        if (alreadyApplied.isPresent()) {
            log.debug("TroveUpdated {}:{} already applied to position {}; skipping",
                    meta.txHash(), meta.logIndex(), alreadyApplied.get().getPositionId());
            return FoldOutcome.REPLAYED;
        }
        if (observation.operation() == LifecycleOperation.OPENED) {
            return open(observation);
        }
        return update(observation);
    }

    /**
     * Pure derivation of wallet, asset, scaled amounts, health ratio, status and history entry.
     */
    public PositionObservation observe(TroveUpdatedEvent event) {
        LogMeta meta = event.meta();
        String wallet = meta.topic(1).map(AbiWords::topicToAddress).orElse("");
        String asset = meta.topic(2).map(AbiWords::topicToAddress).orElse("");
        BigDecimal collateral = decimalScaleResolver.collateral(asset, event.collateral());
        BigDecimal debt = decimalScaleResolver.debt(asset, event.debt());
        LifecycleOperation operation = event.operation();
        PositionStatus status = statusAfter(operation, debt);
        PositionState state = new PositionState(collateral, debt, HealthRatio.of(debt, collateral), status, meta.blockNumber());
        HistoryEntry entry = new HistoryEntry(
                meta.txHash(),
                meta.logIndex(),
                collateral,
                debt,
                operation,
                Instant.now(clock),
                meta.blockNumber());
        return new PositionObservation(wallet, asset, operation, state, entry);
    }

    static PositionStatus statusAfter(LifecycleOperation operation, BigDecimal debt) {
        if (operation == LifecycleOperation.OPENED) {
            return PositionStatus.ACTIVE;
        }
        if (operation == LifecycleOperation.CLOSED) {
            return PositionStatus.CLOSED;
        }
        return debt.signum() == 0 ? PositionStatus.LIQUIDATED : PositionStatus.ACTIVE;
    }

    private FoldOutcome open(PositionObservation observation) {
        String wallet = observation.walletAddress();
        String asset = observation.asset();
        Optional<Position> latest = gateway.findLatest(wallet, asset);
        if (latest.isPresent() && latest.get().getStatus() == PositionStatus.ACTIVE) {
            throw new ActivePositionExistsException(latest.get().getPositionId(), wallet, asset);
        }
        PositionState state = observation.state();
        Position position = new Position();
        position.setPositionId(gateway.nextIdentity());
        position.setWalletAddress(wallet);
        position.setAsset(asset);
        position.setCollateral(state.collateral());
        position.setDebt(state.debt());
        position.setHealthRatio(state.healthRatio());
        position.setStatus(PositionStatus.ACTIVE);
        position.setBlockNumber(state.blockNumber());
        position.setHistory(new ArrayList<>(List.of(observation.historyEntry())));
        Position saved = gateway.insert(position);
        log.info("Position {} opened: wallet={} asset={} coll={} debt={} ratio={}%",
                saved.getPositionId(), wallet, asset, state.collateral().toPlainString(),
                state.debt().toPlainString(), state.healthRatio().toPlainString());
        return FoldOutcome.CREATED;
    }

    private FoldOutcome update(PositionObservation observation) {
        String wallet = observation.walletAddress();
        String asset = observation.asset();
        Position latest = gateway.findLatest(wallet, asset)
                .orElseThrow(() -> new PositionNotFoundException(wallet, asset));
        if (latest.getStatus().isTerminal()) {
            throw new PositionTerminatedException(latest.getPositionId(), latest.getStatus(), wallet, asset);
        }
        PositionState state = observation.state();
        boolean applied = gateway.updateLatest(wallet, asset, EnumSet.of(PositionStatus.ACTIVE), state,
                observation.historyEntry());
        if (!applied) {
            return FoldOutcome.REPLAYED;
        }
        log.info("Position {} {}: wallet={} asset={} coll={} debt={} ratio={}% status={}",
                latest.getPositionId(), observation.operation().name().toLowerCase(), wallet, asset,
                state.collateral().toPlainString(), state.debt().toPlainString(),
                state.healthRatio().toPlainString(), state.status().value());
        return FoldOutcome.UPDATED;
    }
}
