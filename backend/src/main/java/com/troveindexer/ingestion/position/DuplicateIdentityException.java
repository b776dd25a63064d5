package com.troveindexer.ingestion.position;

/**
 * Identity assignment produced an id that is already taken. The counter is broken; indexing must stop.
 */
public class DuplicateIdentityException extends RuntimeException {

    public DuplicateIdentityException(long positionId, Throwable cause) {
        super("positionId " + positionId + " already assigned", cause);
    }
}
