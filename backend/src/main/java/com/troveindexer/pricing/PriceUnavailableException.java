package com.troveindexer.pricing;

/**
 * No usable price: the live call failed for a reason other than a frozen feed, or the fallback record is empty.
 */
public class PriceUnavailableException extends RuntimeException {

    public PriceUnavailableException(String message) {
        super(message);
    }

    public PriceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
