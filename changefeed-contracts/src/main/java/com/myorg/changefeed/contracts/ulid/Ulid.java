package com.myorg.changefeed.contracts.ulid;

import com.myorg.changefeed.contracts.core.exception.ChangefeedIntegrityException;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Objects;

/**
 * 128 bit identifier ordered by time.
 * <p>
 * Layout (big endian):
 * <pre>
 *   bytes 0..5   unix time in milliseconds
 *   bytes 6..7   random bits, fixed for a prefix
 *   bytes 8..15  unsigned counter, incremented by one per id
 * </pre>
 * Ordering is unsigned over the 16 bytes, which is also how PostgreSQL orders {@code bytea}.
 */
public final class Ulid implements Comparable<Ulid> {

    public static final int BYTES = 16;
    public static final long MAX_TIMESTAMP = 0xFFFF_FFFF_FFFFL;

    private static final char[] CROCKFORD = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();

    private final long prefix;
    private final long suffix;

    private Ulid(long prefix, long suffix) {
        this.prefix = prefix;
        this.suffix = suffix;
    }

    public static Ulid of(long prefix, long suffix) {
        return new Ulid(prefix, suffix);
    }

    public static Ulid fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != BYTES) {
            throw new IllegalArgumentException("ULID must be " + BYTES + " bytes, got " + bytes.length);
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        return new Ulid(buf.getLong(), buf.getLong());
    }

    /** Prefix with the given millisecond and 16 random bits. */
    public static long prefix(long epochMillis, int random16) {
        if (epochMillis < 0 || epochMillis > MAX_TIMESTAMP) {
            throw new IllegalArgumentException("timestamp out of ULID range: " + epochMillis);
        }
        return (epochMillis << 16) | (random16 & 0xFFFF);
    }

    public long prefix() { return prefix; }
    public long suffix() { return suffix; }

    public long timestampMillis() {
        return prefix >>> 16;
    }

    public Instant time() {
        return Instant.ofEpochMilli(timestampMillis());
    }

    /** The id right after this one, same prefix. */
    public Ulid next() {
        if (suffix == -1L) {
            throw new ChangefeedIntegrityException("ULID_OVERFLOW", "ULID counter exhausted for prefix " + this);
        }
        return new Ulid(prefix, suffix + 1);
    }

    public byte[] toBytes() {
        return ByteBuffer.allocate(BYTES).putLong(prefix).putLong(suffix).array();
    }

    public byte[] prefixBytes() {
        return ByteBuffer.allocate(Long.BYTES).putLong(prefix).array();
    }

    @Override
    public int compareTo(Ulid o) {
        int c = Long.compareUnsigned(prefix, o.prefix);
        return c != 0 ? c : Long.compareUnsigned(suffix, o.suffix);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Ulid other)) return false;
        return prefix == other.prefix && suffix == other.suffix;
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix, suffix);
    }

    /** 26 characters of Crockford base32. */
    @Override
    public String toString() {
        char[] out = new char[26];
        long hi = prefix;
        long lo = suffix;
        for (int i = 25; i >= 0; i--) {
            out[i] = CROCKFORD[(int) (lo & 0x1F)];
            lo = (lo >>> 5) | (hi << 59);
            hi = hi >>> 5;
        }
        return new String(out);
    }
}
