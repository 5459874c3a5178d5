package com.myorg.changefeed.contracts.feed;

import com.myorg.changefeed.contracts.ulid.Ulid;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Opaque 16 byte position in a feed. Sequence numbered feeds keep the number big endian in
 * the low 8 bytes; ULID feeds use the ULID bytes. Cursors compare as unsigned bytes.
 */
public final class Cursor implements Comparable<Cursor> {

    public static final int BYTES = 16;
    public static final Cursor START = new Cursor(new byte[BYTES]);

    private final byte[] bytes;

    private Cursor(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Cursor fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != BYTES) {
            throw new IllegalArgumentException("cursor must be " + BYTES + " bytes, got " + bytes.length);
        }
        return new Cursor(bytes.clone());
    }

    public static Cursor fromHex(String hex) {
        if (hex == null || hex.isBlank()) return START;
        try {
            return fromBytes(HexFormat.of().parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("malformed cursor: " + hex, e);
        }
    }

    public static Cursor ofSequenceNumber(long sequenceNumber) {
        return new Cursor(ByteBuffer.allocate(BYTES).putLong(0L).putLong(sequenceNumber).array());
    }

    public static Cursor of(Ulid ulid) {
        return new Cursor(ulid.toBytes());
    }

    /** Sequence number held by a cursor of a sequence numbered feed. */
    public long sequenceNumber() {
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        if (buf.getLong() != 0L) {
            throw new IllegalArgumentException("not a sequence number cursor: " + toHex());
        }
        return buf.getLong();
    }

    public Ulid toUlid() {
        return Ulid.fromBytes(bytes);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return HexFormat.of().formatHex(bytes);
    }

    @Override
    public int compareTo(Cursor o) {
        return Arrays.compareUnsigned(bytes, o.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Cursor other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
