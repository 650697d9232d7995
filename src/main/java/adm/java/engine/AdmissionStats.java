package adm.java.engine;

import adm.core.model.DenyReason;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Outcome counters. Quota rejections are expected traffic, so they are
 * counted here instead of being logged as errors.
 */
public final class AdmissionStats {

    private final LongAdder allowed = new LongAdder();
    private final LongAdder bypassed = new LongAdder();
    private final LongAdder blocksImposed = new LongAdder();
    private final EnumMap<DenyReason, LongAdder> denied = new EnumMap<>(DenyReason.class);

    public AdmissionStats() {
        for (DenyReason reason : DenyReason.values()) {
            denied.put(reason, new LongAdder());
        }
    }

    void onAllowed() {
        allowed.increment();
    }

    void onBypassed() {
        bypassed.increment();
    }

    void onDenied(DenyReason reason) {
        denied.get(reason).increment();
    }

    void onBlockImposed() {
        blocksImposed.increment();
    }

    public long allowed() {
        return allowed.sum();
    }

    public long bypassed() {
        return bypassed.sum();
    }

    public long blocksImposed() {
        return blocksImposed.sum();
    }

    public long denied(DenyReason reason) {
        return denied.get(reason).sum();
    }

    public long deniedTotal() {
        long total = 0;
        for (LongAdder adder : denied.values()) {
            total += adder.sum();
        }
        return total;
    }

    /**
     * Point-in-time copy of the denial counters.
     */
    public Map<DenyReason, Long> deniedSnapshot() {
        EnumMap<DenyReason, Long> snapshot = new EnumMap<>(DenyReason.class);
        denied.forEach((reason, adder) -> snapshot.put(reason, adder.sum()));
        return snapshot;
    }
}
