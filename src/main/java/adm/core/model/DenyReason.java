package adm.core.model;

import java.util.Locale;

/**
 * Why a request was denied.
 */
public enum DenyReason {
    /** Client is serving a time-boxed block. */
    BLOCKED,
    /** Sustained (60s) tier budget exhausted. */
    SUSTAINED_EXCEEDED,
    /** Burst (10s) tier budget exhausted. */
    BURST_EXCEEDED,
    /** Per-client budget across all tiers exhausted. */
    GLOBAL_EXCEEDED,
    /** Clock or internal state failure; the decision failed closed. */
    INTERNAL_ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
