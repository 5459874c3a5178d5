package com.myorg.changefeed.contracts.ulid;

import java.time.Instant;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Immutable ULID working state of a shard: the prefix in use and the next counter value to hand out.
 * <p>
 * Stored on the shard row and carried through a writer transaction. The state only moves forward:
 * a time hint in the same or an earlier millisecond than the stored prefix keeps the stored prefix and
 * continues its counter, so ids never regress even when clocks or hints do.
 */
public final class UlidState {

    private final long prefix;
    private final long nextSuffix;

    private UlidState(long prefix, long nextSuffix) {
        this.prefix = prefix;
        this.nextSuffix = nextSuffix;
    }

    public static UlidState of(long prefix, long nextSuffix) {
        return new UlidState(prefix, nextSuffix);
    }

    public static UlidState begin(UlidState stored, Instant timeHint) {
        return begin(stored, timeHint, ThreadLocalRandom.current());
    }

    /**
     * State for a new writer. {@code stored} may be null for a shard that never issued an id.
     */
    public static UlidState begin(UlidState stored, Instant timeHint, Random random) {
        Objects.requireNonNull(timeHint, "timeHint");
        long hintMillis = timeHint.toEpochMilli();
        if (stored != null && hintMillis <= stored.timestampMillis()) {
            return stored;
        }
        return new UlidState(Ulid.prefix(hintMillis, random.nextInt(1 << 16)), 0L);
    }

    /** The id the next call to {@link #advance()} moves past. */
    public Ulid current() {
        return Ulid.of(prefix, nextSuffix);
    }

    public UlidState advance() {
        return new UlidState(prefix, current().next().suffix());
    }

    public long prefix() { return prefix; }
    public long nextSuffix() { return nextSuffix; }

    public long timestampMillis() {
        return prefix >>> 16;
    }

    public Instant time() {
        return Instant.ofEpochMilli(timestampMillis());
    }

    public byte[] prefixBytes() {
        return current().prefixBytes();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UlidState other)) return false;
        return prefix == other.prefix && nextSuffix == other.nextSuffix;
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix, nextSuffix);
    }

    @Override
    public String toString() {
        return "UlidState{" + current() + "}";
    }
}
