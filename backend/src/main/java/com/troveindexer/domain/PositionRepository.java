package com.troveindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for positions. Writes go through the position gateway; reads serve the API.
 */
public interface PositionRepository extends MongoRepository<Position, String>, PositionRepositoryCustom {

    Optional<Position> findByPositionId(long positionId);

    /** Highest assigned identity; empty when no position exists yet. */
    Optional<Position> findTopByOrderByPositionIdDesc();

    /** Most recently created record for the pair, regardless of status. */
    Optional<Position> findTopByWalletAddressAndAssetOrderByPositionIdDesc(String walletAddress, String asset);

    List<Position> findByStatus(PositionStatus status);

}
