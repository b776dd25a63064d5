package com.troveindexer.query;

/**
 * Read-side lookup by positionId found nothing.
 */
public class UnknownPositionException extends RuntimeException {

    public UnknownPositionException(long positionId) {
        super("Position " + positionId + " not found");
    }
}
