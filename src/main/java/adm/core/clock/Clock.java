package adm.core.clock;

/**
 * Monotonic time source, injected everywhere time is read.
 *
 * <p>Implementations may throw if the underlying source is unavailable;
 * callers on the admission path treat that as a reason to deny.
 */
public interface Clock {
    long nowNanos();
}
