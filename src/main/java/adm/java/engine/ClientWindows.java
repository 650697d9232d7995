package adm.java.engine;

import adm.core.model.Tier;
import adm.core.window.WindowLog;

import java.util.EnumMap;

/**
 * All window logs of one client: admitted requests per tier (GLOBAL included)
 * and sustained-budget violations per tier.
 *
 * Thread-safety:
 * - Every method must be called while holding this object's monitor
 * - Once retired (evicted from its shard) the instance must not be written;
 *   writers re-fetch a live instance instead
 */
final class ClientWindows {

    private final EnumMap<Tier, WindowLog> admitted = new EnumMap<>(Tier.class);
    private final EnumMap<Tier, WindowLog> violations = new EnumMap<>(Tier.class);
    private boolean retired;

    WindowLog admitted(Tier tier) {
        return admitted.computeIfAbsent(tier, t -> new WindowLog());
    }

    WindowLog violations(Tier tier) {
        return violations.computeIfAbsent(tier, t -> new WindowLog());
    }

    WindowLog admittedIfPresent(Tier tier) {
        return admitted.get(tier);
    }

    WindowLog violationsIfPresent(Tier tier) {
        return violations.get(tier);
    }

    /**
     * Prunes every log to the cutoff.
     *
     * @return true if no entry survived
     */
    boolean pruneAll(long cutoffNanos) {
        boolean empty = true;
        for (WindowLog log : admitted.values()) {
            log.prune(cutoffNanos);
            empty &= log.isEmpty();
        }
        for (WindowLog log : violations.values()) {
            log.prune(cutoffNanos);
            empty &= log.isEmpty();
        }
        return empty;
    }

    boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
    }
}
