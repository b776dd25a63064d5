package com.troveindexer.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of PositionRepositoryCustom using MongoTemplate.
 */
@Repository
@RequiredArgsConstructor
public class PositionRepositoryImpl implements PositionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<Position> findLatest(String walletAddress, String asset, Collection<PositionStatus> statuses) {
        Query query = new Query(where("walletAddress").is(walletAddress)
                .and("asset").is(asset)
                .and("status").in(statuses))
                .with(Sort.by(Sort.Direction.DESC, "positionId"))
                .limit(1);
        return Optional.ofNullable(mongoTemplate.findOne(query, Position.class));
    }

    @Override
    public Optional<Position> findByHistoryEntry(String txHash, long logIndex) {
        Query query = new Query(where("history").elemMatch(where("txHash").is(txHash).and("logIndex").is(logIndex)));
        return Optional.ofNullable(mongoTemplate.findOne(query, Position.class));
    }

    @Override
    public boolean applyUpdate(long positionId, BigDecimal collateral, BigDecimal debt, BigDecimal healthRatio,
                               PositionStatus status, long blockNumber, HistoryEntry entry) {
        Query query = new Query(new Criteria().andOperator(
                where("positionId").is(positionId),
                where("history").not().elemMatch(where("txHash").is(entry.txHash()).and("logIndex").is(entry.logIndex()))));
        Update update = new Update()
                .set("collateral", collateral)
                .set("debt", debt)
                .set("healthRatio", healthRatio)
                .set("status", status)
                .set("blockNumber", blockNumber)
                .push("history", entry);
        return mongoTemplate.updateFirst(query, update, Position.class).getModifiedCount() > 0;
    }

    @Override
    public List<Position> search(String walletAddress, String asset, PositionStatus status) {
        Query query = new Query().with(Sort.by(Sort.Direction.ASC, "positionId"));
        if (walletAddress != null) {
            query.addCriteria(where("walletAddress").is(walletAddress));
        }
        if (asset != null) {
            query.addCriteria(where("asset").is(asset));
        }
        if (status != null) {
            query.addCriteria(where("status").is(status));
        }
        return mongoTemplate.find(query, Position.class);
    }
}
