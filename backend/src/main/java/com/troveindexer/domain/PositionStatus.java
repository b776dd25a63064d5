package com.troveindexer.domain;

/**
 * Lifecycle status of a position. CLOSED and LIQUIDATED are terminal.
 */
public enum PositionStatus {
    ACTIVE,
    CLOSED,
    LIQUIDATED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    /** Lowercase wire value used by the read API ("active", "closed", "liquidated"). */
    public String value() {
        return name().toLowerCase();
    }
}
