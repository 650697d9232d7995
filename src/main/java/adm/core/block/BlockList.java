package adm.core.block;

/**
 * Time-boxed client blocks, keyed by client identity.
 *
 * <p>Reads are self-cleaning: a lookup at or past the unblock time evicts
 * the entry, so once a block lapses it stays lapsed until the next
 * {@link #block} call.
 */
public interface BlockList {

    /**
     * Time left on the client's block, or 0 if the client is not blocked.
     */
    long remainingNanos(String client, long nowNanos);

    default boolean isBlocked(String client, long nowNanos) {
        return remainingNanos(client, nowNanos) > 0;
    }

    /**
     * Blocks the client until {@code nowNanos + durationNanos}.
     * An active block that already ends later is left as is.
     *
     * @return the unblock time in effect after the call
     */
    long block(String client, long durationNanos, long nowNanos);

    /**
     * Removes every lapsed block.
     *
     * @return number of entries removed
     */
    int purgeExpired(long nowNanos);

    int size();
}
