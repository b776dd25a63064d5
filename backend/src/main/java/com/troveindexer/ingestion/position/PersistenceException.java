package com.troveindexer.ingestion.position;

/**
 * The document store rejected a write. The batch is retried as a whole; individual writes are not.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
