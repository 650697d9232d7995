package adm.core.model;

/**
 * Budget of one tier.
 *
 * @param sustained Maximum requests in the sustained window (60s)
 * @param burst Maximum requests in the burst window (10s); 0 means no burst check (GLOBAL)
 */
public record TierLimits(int sustained, int burst) {

    public TierLimits {
        if (sustained <= 0) throw new IllegalArgumentException("sustained must be > 0");
        if (burst < 0) throw new IllegalArgumentException("burst must be >= 0");
    }

    public static TierLimits of(int sustained, int burst) {
        return new TierLimits(sustained, burst);
    }

    public static TierLimits sustainedOnly(int sustained) {
        return new TierLimits(sustained, 0);
    }

    public boolean hasBurst() {
        return burst > 0;
    }
}
