package adm.java.engine;

import adm.core.block.BlockList;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link BlockList} backed by a ConcurrentHashMap of
 * client → unblock time.
 *
 * Blocks only ever extend: a new block that would end earlier than the
 * active one leaves the active one in place. Bounded by the number of
 * currently blocked clients, since lapsed entries are removed on read and
 * by {@link #purgeExpired}.
 */
public final class InMemoryBlockList implements BlockList {

    private final ConcurrentHashMap<String, Long> unblockAt = new ConcurrentHashMap<>();

    @Override
    public long remainingNanos(String client, long nowNanos) {
        Long until = unblockAt.get(client);
        if (until == null) {
            return 0L;
        }
        if (nowNanos < until) {
            return until - nowNanos;
        }
        // lapsed: remove only the value we saw, a concurrent re-block stays
        unblockAt.remove(client, until);
        return 0L;
    }

    @Override
    public long block(String client, long durationNanos, long nowNanos) {
        if (durationNanos <= 0) {
            throw new IllegalArgumentException("durationNanos must be > 0");
        }
        long candidate = nowNanos + durationNanos;
        return unblockAt.merge(client, candidate, (current, proposed) ->
            nowNanos < current && current >= proposed ? current : proposed);
    }

    @Override
    public int purgeExpired(long nowNanos) {
        int removed = 0;
        for (Map.Entry<String, Long> entry : unblockAt.entrySet()) {
            if (nowNanos >= entry.getValue() && unblockAt.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return unblockAt.size();
    }
}
