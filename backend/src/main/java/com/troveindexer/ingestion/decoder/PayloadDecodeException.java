package com.troveindexer.ingestion.decoder;

/**
 * A resolved log whose payload does not match its event shape. Per-event: the log is skipped, the batch
 * continues.
 */
public class PayloadDecodeException extends RuntimeException {

    public PayloadDecodeException(String message) {
        super(message);
    }

    public PayloadDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
