package adm.java.engine;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of locks, one per client shard (hash(client) mod stripes).
 *
 * Two clients contend only when they land on the same stripe; a single
 * client always maps to the same lock, which makes its decisions linearizable.
 * The locks are reentrant so accountant calls made under a stripe may lock again.
 */
final class StripedLocks {

    private final ReentrantLock[] locks;

    StripedLocks(int stripes) {
        if (stripes <= 0) {
            throw new IllegalArgumentException("stripes must be > 0");
        }
        this.locks = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            locks[i] = new ReentrantLock(); // Non-fair for better throughput
        }
    }

    ReentrantLock lockFor(String client) {
        return locks[indexFor(client, locks.length)];
    }

    static int indexFor(String client, int buckets) {
        int h = client.hashCode();
        h ^= (h >>> 16);
        return Math.floorMod(h, buckets);
    }
}
