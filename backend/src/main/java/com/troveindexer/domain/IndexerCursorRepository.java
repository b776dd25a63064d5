package com.troveindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for indexer_cursor, keyed by cursor id.
 */
public interface IndexerCursorRepository extends MongoRepository<IndexerCursor, String> {
}
