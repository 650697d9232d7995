package adm.java.engine;

import adm.core.model.Tier;
import adm.core.model.TierLimits;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for an {@link AdmissionDecider}.
 *
 * @param tierLimits Sustained and burst limits for HEALTH, API, ML and DATA
 * @param globalLimit Per-client budget across all tiers within the sustained window
 * @param sustainedWindow Window of the sustained and global limits
 * @param burstWindow Window of the burst limits
 * @param sustainedBlock Block imposed when sustained violations reach twice the tier limit
 * @param globalBlock Block imposed when the global limit is reached
 * @param bypass Client identities that are never limited
 * @param shards Number of lock stripes and accountant shards
 * @param maxClients Upper bound on clients with tracked windows
 * @param sweepInterval Period of the idle-client sweep
 */
public record AdmissionConfig(
    Map<Tier, TierLimits> tierLimits,
    int globalLimit,
    Duration sustainedWindow,
    Duration burstWindow,
    Duration sustainedBlock,
    Duration globalBlock,
    Set<String> bypass,
    int shards,
    int maxClients,
    Duration sweepInterval
) {
    public static final int DEFAULT_GLOBAL_LIMIT = 100;

    public AdmissionConfig {
        if (tierLimits == null) throw new IllegalArgumentException("tierLimits cannot be null");
        for (Tier tier : Tier.values()) {
            if (!tier.isGlobal() && !tierLimits.containsKey(tier)) {
                throw new IllegalArgumentException("missing limits for tier " + tier.wireName());
            }
        }
        if (globalLimit <= 0) throw new IllegalArgumentException("globalLimit must be > 0");
        requirePositive(sustainedWindow, "sustainedWindow");
        requirePositive(burstWindow, "burstWindow");
        requirePositive(sustainedBlock, "sustainedBlock");
        requirePositive(globalBlock, "globalBlock");
        requirePositive(sweepInterval, "sweepInterval");
        if (burstWindow.compareTo(sustainedWindow) > 0) {
            throw new IllegalArgumentException("burstWindow must not exceed sustainedWindow");
        }
        if (shards <= 0) throw new IllegalArgumentException("shards must be > 0");
        if (maxClients < shards) throw new IllegalArgumentException("maxClients must be >= shards");

        EnumMap<Tier, TierLimits> copy = new EnumMap<>(Tier.class);
        copy.putAll(tierLimits);
        copy.remove(Tier.GLOBAL);
        tierLimits = Collections.unmodifiableMap(copy);
        bypass = bypass == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(bypass));
    }

    /**
     * Production defaults: health 60/60s (burst 60), api 30/60s (burst 10),
     * ml 10/60s (burst 2), data 50/60s (burst 15), global 100/60s,
     * 300s and 600s blocks, loopback bypassed.
     */
    public static AdmissionConfig defaults() {
        EnumMap<Tier, TierLimits> limits = new EnumMap<>(Tier.class);
        limits.put(Tier.HEALTH, TierLimits.of(60, 60));
        limits.put(Tier.API, TierLimits.of(30, 10));
        limits.put(Tier.ML, TierLimits.of(10, 2));
        limits.put(Tier.DATA, TierLimits.of(50, 15));

        return new AdmissionConfig(
            limits,
            DEFAULT_GLOBAL_LIMIT,
            Duration.ofSeconds(60),
            Duration.ofSeconds(10),
            Duration.ofSeconds(300),
            Duration.ofSeconds(600),
            Set.of("127.0.0.1", "::1"),
            64,
            100_000,
            Duration.ofSeconds(30)
        );
    }

    /**
     * Limits of a tier; GLOBAL reports the global limit with no burst.
     */
    public TierLimits limitsFor(Tier tier) {
        if (tier.isGlobal()) {
            return TierLimits.sustainedOnly(globalLimit);
        }
        return tierLimits.get(tier);
    }

    public boolean isBypassed(String client) {
        return bypass.contains(client);
    }

    public AdmissionConfig withTierLimits(Tier tier, TierLimits limits) {
        if (tier == null || tier.isGlobal()) {
            throw new IllegalArgumentException("use withGlobalLimit for the global tier");
        }
        EnumMap<Tier, TierLimits> copy = new EnumMap<>(Tier.class);
        copy.putAll(tierLimits);
        copy.put(tier, limits);
        return new AdmissionConfig(copy, globalLimit, sustainedWindow, burstWindow,
            sustainedBlock, globalBlock, bypass, shards, maxClients, sweepInterval);
    }

    public AdmissionConfig withGlobalLimit(int limit) {
        return new AdmissionConfig(tierLimits, limit, sustainedWindow, burstWindow,
            sustainedBlock, globalBlock, bypass, shards, maxClients, sweepInterval);
    }

    public AdmissionConfig withBlockDurations(Duration sustained, Duration global) {
        return new AdmissionConfig(tierLimits, globalLimit, sustainedWindow, burstWindow,
            sustained, global, bypass, shards, maxClients, sweepInterval);
    }

    public AdmissionConfig withBypass(Set<String> identities) {
        return new AdmissionConfig(tierLimits, globalLimit, sustainedWindow, burstWindow,
            sustainedBlock, globalBlock, identities, shards, maxClients, sweepInterval);
    }

    public AdmissionConfig withCapacity(int shardCount, int clientCap) {
        return new AdmissionConfig(tierLimits, globalLimit, sustainedWindow, burstWindow,
            sustainedBlock, globalBlock, bypass, shardCount, clientCap, sweepInterval);
    }

    public AdmissionConfig withSweepInterval(Duration interval) {
        return new AdmissionConfig(tierLimits, globalLimit, sustainedWindow, burstWindow,
            sustainedBlock, globalBlock, bypass, shards, maxClients, interval);
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }
}
