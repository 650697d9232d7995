package adm.core.window;

import adm.core.model.Tier;

import java.util.OptionalLong;

/**
 * Sliding-window request accounting per (client, tier) and per (client, GLOBAL).
 *
 * <p>Every tier keeps a single log; the sustained and burst counts are two
 * windows over the same entries. Implementations must make each call atomic
 * per client and must not serialize unrelated clients on one lock.
 *
 * <p>An in-process implementation lives in the engine; a shared counting
 * store can stand behind the same contract without touching the decider.
 */
public interface WindowAccountant {

    /**
     * Records an admitted request in the tier log and in the client's GLOBAL log.
     * Recording GLOBAL directly only touches the GLOBAL log.
     */
    void record(String client, Tier tier, long nowNanos);

    /**
     * Number of admitted requests in the trailing {@code windowNanos}.
     * Entries past the retention window are pruned as a side effect.
     */
    int countSince(String client, Tier tier, long windowNanos, long nowNanos);

    /**
     * Timestamp of the oldest admitted request inside the trailing window.
     */
    OptionalLong oldestSince(String client, Tier tier, long windowNanos, long nowNanos);

    /**
     * Records a request rejected for exceeding the sustained budget.
     * Violations never count against quota; they only drive block escalation.
     */
    void recordViolation(String client, Tier tier, long nowNanos);

    /**
     * Number of sustained-budget violations in the trailing {@code windowNanos}.
     */
    int violationsSince(String client, Tier tier, long windowNanos, long nowNanos);

    /**
     * Drops every client whose logs have all aged out.
     *
     * @return number of clients dropped
     */
    int evictIdle(long nowNanos);

    /**
     * Number of clients currently holding state.
     */
    int trackedClients();
}
