package adm.java.engine;

import adm.core.block.BlockList;
import adm.core.classify.RequestClassifier;
import adm.core.clock.Clock;
import adm.core.model.Decision;
import adm.core.model.DenyReason;
import adm.core.model.Tier;
import adm.core.model.TierLimits;
import adm.core.window.WindowAccountant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe multi-tier admission controller.
 *
 * Each call classifies the request path into a tier, then checks in order:
 * <ol>
 *   <li>active block → BLOCKED</li>
 *   <li>sustained tier budget → SUSTAINED_EXCEEDED, blocking once violations
 *       reach twice the tier limit</li>
 *   <li>burst tier budget → BURST_EXCEEDED (never blocks)</li>
 *   <li>per-client global budget → GLOBAL_EXCEEDED and a block</li>
 * </ol>
 * Only a request that passes every check is recorded, so denied traffic never
 * consumes quota.
 *
 * Thread-safety:
 * - All checks and the final record for a client run under that client's
 *   stripe lock, so concurrent requests from one client cannot both pass a
 *   check-then-record on the same count
 * - Different clients contend only when they share a stripe
 *
 * Failure: a clock that throws, or any unexpected runtime failure while
 * deciding, denies the request with INTERNAL_ERROR and logs at ERROR.
 *
 * Usage example:
 * <pre>
 * AdmissionDecider decider = new AdmissionDecider(SystemClock.instance(), AdmissionConfig.defaults());
 *
 * Decision decision = decider.decide(clientIp, "/api/ml/predict/7203");
 * if (decision.allowed()) {
 *     // Process request
 * } else {
 *     // 429 with Retry-After: decision.retryAfterSeconds()
 * }
 * </pre>
 */
public final class AdmissionDecider {

    private static final Logger log = LoggerFactory.getLogger(AdmissionDecider.class);

    private static final long NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);
    private static final long FAIL_CLOSED_RETRY_NANOS = NANOS_PER_SECOND;

    private final Clock clock;
    private final AdmissionConfig config;
    private final WindowAccountant accountant;
    private final BlockList blockList;
    private final StripedLocks locks;
    private final AdmissionStats stats = new AdmissionStats();

    private final long sustainedWindowNanos;
    private final long burstWindowNanos;
    private final long sustainedBlockNanos;
    private final long globalBlockNanos;

    /**
     * Creates a decider with process-local accounting and block list.
     *
     * @param clock Clock instance for time control (injected for testability)
     * @param config Limits, escalation and capacity settings
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public AdmissionDecider(Clock clock, AdmissionConfig config) {
        this(clock, config,
            config == null ? null : new InMemoryWindowAccountant(
                config.sustainedWindow().toNanos(), config.shards(), config.maxClients()),
            new InMemoryBlockList());
    }

    /**
     * Creates a decider over caller-supplied state stores.
     *
     * @throws IllegalArgumentException if any parameter is null
     */
    public AdmissionDecider(Clock clock, AdmissionConfig config, WindowAccountant accountant, BlockList blockList) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (accountant == null) {
            throw new IllegalArgumentException("accountant cannot be null");
        }
        if (blockList == null) {
            throw new IllegalArgumentException("blockList cannot be null");
        }

        this.clock = clock;
        this.config = config;
        this.accountant = accountant;
        this.blockList = blockList;
        this.locks = new StripedLocks(config.shards());

        this.sustainedWindowNanos = config.sustainedWindow().toNanos();
        this.burstWindowNanos = config.burstWindow().toNanos();
        this.sustainedBlockNanos = config.sustainedBlock().toNanos();
        this.globalBlockNanos = config.globalBlock().toNanos();
    }

    /**
     * Decides a request at the current clock time.
     *
     * @param client Client identity (forwarded-for or peer address)
     * @param path Request path, used only for classification
     * @return the decision, never null
     * @throws IllegalArgumentException if client is null
     */
    public Decision decide(String client, String path) {
        requireClient(client);
        Tier tier = RequestClassifier.classify(path);

        ReentrantLock lock = locks.lockFor(client);
        lock.lock();
        try {
            long now;
            try {
                now = clock.nowNanos();
            } catch (RuntimeException e) {
                // no reading to anchor a reset time; renderers use the retry hint
                return failClosed(client, tier, 0L, e);
            }
            return evaluate(client, tier, now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Decides a request at an explicit time on this decider's clock timeline.
     *
     * @throws IllegalArgumentException if client is null
     */
    public Decision decide(String client, String path, long nowNanos) {
        requireClient(client);
        Tier tier = RequestClassifier.classify(path);

        ReentrantLock lock = locks.lockFor(client);
        lock.lock();
        try {
            return evaluate(client, tier, nowNanos);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops idle client windows and lapsed blocks. Runs off the request path.
     *
     * @return number of client windows dropped
     */
    public int sweep() {
        long now = clock.nowNanos();
        int idle = accountant.evictIdle(now);
        int lapsed = blockList.purgeExpired(now);
        if (idle > 0 || lapsed > 0) {
            log.debug("Sweep dropped {} idle clients and {} lapsed blocks ({} clients tracked, {} blocked)",
                idle, lapsed, accountant.trackedClients(), blockList.size());
        }
        return idle;
    }

    private Decision evaluate(String client, Tier tier, long now) {
        try {
            TierLimits limits = config.limitsFor(tier);

            if (config.isBypassed(client)) {
                stats.onBypassed();
                return Decision.allow(tier, limits.sustained(), limits.sustained(), now + sustainedWindowNanos);
            }

            long blockedFor = blockList.remainingNanos(client, now);
            if (blockedFor > 0) {
                log.debug("Denied blocked client {} on tier {}", client, tier.wireName());
                return deny(DenyReason.BLOCKED, tier, limits.sustained(), blockedFor, now + blockedFor);
            }

            int sustained = accountant.countSince(client, tier, sustainedWindowNanos, now);
            if (sustained >= limits.sustained()) {
                long resetAt = accountant.oldestSince(client, tier, sustainedWindowNanos, now).orElse(now)
                    + sustainedWindowNanos;
                int priorViolations = accountant.violationsSince(client, tier, sustainedWindowNanos, now);
                accountant.recordViolation(client, tier, now);
                if (sustained + priorViolations + 1 >= 2L * limits.sustained()) {
                    imposeBlock(client, tier, sustainedBlockNanos, now, DenyReason.SUSTAINED_EXCEEDED);
                }
                return deny(DenyReason.SUSTAINED_EXCEEDED, tier, limits.sustained(), resetAt - now, resetAt);
            }

            if (limits.hasBurst()) {
                int burst = accountant.countSince(client, tier, burstWindowNanos, now);
                if (burst >= limits.burst()) {
                    return deny(DenyReason.BURST_EXCEEDED, tier, limits.burst(), burstWindowNanos, now + burstWindowNanos);
                }
            }

            int global = accountant.countSince(client, Tier.GLOBAL, sustainedWindowNanos, now);
            if (global >= config.globalLimit()) {
                long until = imposeBlock(client, tier, globalBlockNanos, now, DenyReason.GLOBAL_EXCEEDED);
                return deny(DenyReason.GLOBAL_EXCEEDED, tier, config.globalLimit(), until - now, until);
            }

            accountant.record(client, tier, now);
            stats.onAllowed();

            long oldest = sustained == 0
                ? now
                : accountant.oldestSince(client, tier, sustainedWindowNanos, now).orElse(now);
            return Decision.allow(tier, limits.sustained(), limits.sustained() - sustained - 1,
                oldest + sustainedWindowNanos);
        } catch (RuntimeException e) {
            return failClosed(client, tier, now + FAIL_CLOSED_RETRY_NANOS, e);
        }
    }

    private long imposeBlock(String client, Tier tier, long durationNanos, long now, DenyReason cause) {
        long until = blockList.block(client, durationNanos, now);
        stats.onBlockImposed();
        log.warn("Blocking client {} for {}s after {} on tier {}",
            client, ceilSeconds(until - now), cause.wireName(), tier.wireName());
        return until;
    }

    private Decision deny(DenyReason reason, Tier tier, int limit, long retryAfterNanos, long resetAtNanos) {
        stats.onDenied(reason);
        return Decision.deny(reason, tier, limit, ceilSeconds(retryAfterNanos), resetAtNanos);
    }

    private Decision failClosed(String client, Tier tier, long resetAtNanos, RuntimeException cause) {
        log.error("Admission check failed for client {} on tier {}; denying", client, tier.wireName(), cause);
        stats.onDenied(DenyReason.INTERNAL_ERROR);
        return Decision.deny(DenyReason.INTERNAL_ERROR, tier, config.limitsFor(tier).sustained(),
            ceilSeconds(FAIL_CLOSED_RETRY_NANOS), resetAtNanos);
    }

    private static void requireClient(String client) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
    }

    static long ceilSeconds(long nanos) {
        if (nanos <= 0) {
            return 0L;
        }
        return (nanos + NANOS_PER_SECOND - 1) / NANOS_PER_SECOND;
    }

    public AdmissionConfig getConfig() {
        return config;
    }

    public AdmissionStats getStats() {
        return stats;
    }

    public WindowAccountant getAccountant() {
        return accountant;
    }

    public BlockList getBlockList() {
        return blockList;
    }

    public Clock getClock() {
        return clock;
    }
}
