package com.troveindexer.ingestion.store;

import com.troveindexer.domain.IndexerCursor;
import com.troveindexer.domain.IndexerCursorRepository;
import com.troveindexer.ingestion.position.PersistenceException;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.OptionalLong;

/**
 * Durable checkpoint of the last fully processed block.
 */
@Service
@RequiredArgsConstructor
public class CursorStore {

    private final IndexerCursorRepository repository;
    private final Clock clock;

    public OptionalLong load(String cursorId) {
        try {
            return repository.findById(cursorId)
                    .map(c -> OptionalLong.of(c.getLastProcessedBlock()))
                    .orElse(OptionalLong.empty());
        } catch (DataAccessException e) {
            throw new PersistenceException("load cursor " + cursorId + " failed", e);
        }
    }

    public void save(String cursorId, long lastProcessedBlock) {
        IndexerCursor cursor = new IndexerCursor();
        cursor.setId(cursorId);
        cursor.setLastProcessedBlock(lastProcessedBlock);
        cursor.setUpdatedAt(Instant.now(clock));
        try {
            repository.save(cursor);
        } catch (DataAccessException e) {
            throw new PersistenceException("save cursor " + cursorId + " at " + lastProcessedBlock + " failed", e);
        }
    }
}
