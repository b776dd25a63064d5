package com.troveindexer.domain;

/**
 * TroveManager operation code carried by TroveUpdated: 0 open, 1 close, 2 adjust. Anything else is UNKNOWN.
 */
public enum LifecycleOperation {
    OPENED,
    CLOSED,
    ADJUSTED,
    UNKNOWN;

    public static LifecycleOperation fromCode(int code) {
        return switch (code) {
            case 0 -> OPENED;
            case 1 -> CLOSED;
            case 2 -> ADJUSTED;
            default -> UNKNOWN;
        };
    }
}
