package adm.core.model;

import java.util.Locale;

/**
 * Traffic classes, each with its own rate budget.
 *
 * <p>GLOBAL is never produced by classification; it names the per-client
 * log that spans every other tier.
 */
public enum Tier {
    HEALTH,
    API,
    ML,
    DATA,
    GLOBAL;

    /**
     * Lower-case name used in headers and response bodies.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isGlobal() {
        return this == GLOBAL;
    }
}
