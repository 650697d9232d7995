package adm.core.model;

/**
 * Outcome of one admission check.
 *
 * @param allowed Whether the request may proceed
 * @param tier Tier the request was classified into
 * @param limit Budget the decision was made against (tier or global limit)
 * @param remaining Requests left in the sustained window; meaningful only when allowed
 * @param retryAfterSeconds Seconds to wait before retrying; meaningful only when denied
 * @param resetAtNanos Clock time at which the relevant window or block frees up; 0 when
 *                     the clock could not be read (INTERNAL_ERROR), where only the retry hint applies
 * @param reason Deny reason, or null when allowed
 */
public record Decision(
    boolean allowed,
    Tier tier,
    int limit,
    int remaining,
    long retryAfterSeconds,
    long resetAtNanos,
    DenyReason reason
) {
    public static Decision allow(Tier tier, int limit, int remaining, long resetAtNanos) {
        return new Decision(true, tier, limit, Math.max(0, remaining), 0L, resetAtNanos, null);
    }

    public static Decision deny(DenyReason reason, Tier tier, int limit, long retryAfterSeconds, long resetAtNanos) {
        if (reason == null) throw new IllegalArgumentException("reason cannot be null");
        // every denial carries a usable retry hint
        return new Decision(false, tier, limit, 0, Math.max(1L, retryAfterSeconds), resetAtNanos, reason);
    }
}
