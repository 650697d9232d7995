package adm.java.engine;

import adm.core.model.Tier;
import adm.core.window.WindowAccountant;
import adm.core.window.WindowLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Function;

/**
 * Process-local {@link WindowAccountant}.
 *
 * Architecture:
 * - Clients are spread over shards by hash(client) mod shards
 * - Each shard is an LRUCache of client → ClientWindows, bounded to
 *   maxClients / shards entries, so memory stays bounded for any traffic mix
 * - Per-client work runs under the ClientWindows monitor; shard monitors are
 *   held only for lookup and insert
 *
 * Memory management:
 * - Logs are pruned to the retention window on every touch
 * - evictIdle drops clients whose logs have all aged out
 * - Capacity eviction drops the least recently seen client of a full shard
 *   (its accounting is lost, which only ever favors that client)
 */
public final class InMemoryWindowAccountant implements WindowAccountant {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWindowAccountant.class);

    private final long retentionNanos;
    private final List<LRUCache<String, ClientWindows>> shards;
    private final LongAdder capacityEvictions = new LongAdder();

    /**
     * @param retentionNanos Longest window ever queried (the sustained window)
     * @param shards Number of shards
     * @param maxClients Upper bound on tracked clients across all shards
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public InMemoryWindowAccountant(long retentionNanos, int shards, int maxClients) {
        if (retentionNanos <= 0) {
            throw new IllegalArgumentException("retentionNanos must be > 0");
        }
        if (shards <= 0) {
            throw new IllegalArgumentException("shards must be > 0");
        }
        if (maxClients < shards) {
            throw new IllegalArgumentException("maxClients must be >= shards");
        }

        this.retentionNanos = retentionNanos;
        List<LRUCache<String, ClientWindows>> built = new ArrayList<>(shards);
        int perShard = maxClients / shards;
        for (int i = 0; i < shards; i++) {
            built.add(new LRUCache<>(perShard, (client, windows) -> {
                synchronized (windows) {
                    windows.retire();
                }
                capacityEvictions.increment();
                log.debug("Evicted least recently used client {} at shard capacity", client);
            }));
        }
        this.shards = List.copyOf(built);
    }

    @Override
    public void record(String client, Tier tier, long nowNanos) {
        write(client, windows -> {
            windows.admitted(tier).append(nowNanos);
            if (!tier.isGlobal()) {
                windows.admitted(Tier.GLOBAL).append(nowNanos);
            }
            return null;
        });
    }

    @Override
    public int countSince(String client, Tier tier, long windowNanos, long nowNanos) {
        ClientWindows windows = shardFor(client).get(client);
        if (windows == null) {
            return 0;
        }
        synchronized (windows) {
            WindowLog entries = windows.admittedIfPresent(tier);
            if (entries == null) {
                return 0;
            }
            entries.prune(nowNanos - retentionNanos);
            return entries.countAfter(nowNanos - windowNanos);
        }
    }

    @Override
    public OptionalLong oldestSince(String client, Tier tier, long windowNanos, long nowNanos) {
        ClientWindows windows = shardFor(client).get(client);
        if (windows == null) {
            return OptionalLong.empty();
        }
        synchronized (windows) {
            WindowLog entries = windows.admittedIfPresent(tier);
            return entries == null ? OptionalLong.empty() : entries.oldestAfter(nowNanos - windowNanos);
        }
    }

    @Override
    public void recordViolation(String client, Tier tier, long nowNanos) {
        write(client, windows -> {
            WindowLog entries = windows.violations(tier);
            entries.prune(nowNanos - retentionNanos);
            entries.append(nowNanos);
            return null;
        });
    }

    @Override
    public int violationsSince(String client, Tier tier, long windowNanos, long nowNanos) {
        ClientWindows windows = shardFor(client).get(client);
        if (windows == null) {
            return 0;
        }
        synchronized (windows) {
            WindowLog entries = windows.violationsIfPresent(tier);
            if (entries == null) {
                return 0;
            }
            entries.prune(nowNanos - retentionNanos);
            return entries.countAfter(nowNanos - windowNanos);
        }
    }

    @Override
    public int evictIdle(long nowNanos) {
        long cutoff = nowNanos - retentionNanos;
        int evicted = 0;
        for (LRUCache<String, ClientWindows> shard : shards) {
            evicted += shard.removeIf(windows -> {
                synchronized (windows) {
                    if (windows.pruneAll(cutoff)) {
                        windows.retire();
                        return true;
                    }
                    return false;
                }
            });
        }
        return evicted;
    }

    @Override
    public int trackedClients() {
        int total = 0;
        for (LRUCache<String, ClientWindows> shard : shards) {
            total += shard.size();
        }
        return total;
    }

    /**
     * Number of clients dropped because their shard was full.
     */
    public long capacityEvictions() {
        return capacityEvictions.sum();
    }

    /**
     * Clears all client state. Primarily useful for testing.
     */
    public void clear() {
        for (LRUCache<String, ClientWindows> shard : shards) {
            shard.clear();
        }
    }

    /**
     * Runs a mutation against a live ClientWindows, re-fetching if the instance
     * was retired between lookup and lock.
     */
    private <T> T write(String client, Function<ClientWindows, T> mutation) {
        LRUCache<String, ClientWindows> shard = shardFor(client);
        while (true) {
            ClientWindows windows = shard.computeIfAbsent(client, c -> new ClientWindows());
            synchronized (windows) {
                if (!windows.isRetired()) {
                    return mutation.apply(windows);
                }
            }
        }
    }

    private LRUCache<String, ClientWindows> shardFor(String client) {
        return shards.get(StripedLocks.indexFor(client, shards.size()));
    }
}
