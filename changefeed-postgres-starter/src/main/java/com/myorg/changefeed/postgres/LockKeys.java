package com.myorg.changefeed.postgres;

import java.nio.charset.StandardCharsets;

/**
 * Advisory lock keys. Names are hashed with 64 bit FNV-1a so the key can be computed on the
 * client and matched against {@code pg_locks} (high half in {@code classid}, low half in {@code objid}).
 */
public final class LockKeys {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    /**
     * First half of the two-int key {@code (CHANGE_WRITER_CLASS, sweep_group)} taken by the change insert
     * trigger of {@code V1__changefeed.sql}. Two-int keys show up with {@code objsubid = 2}, so they never
     * collide with the hashed keys below.
     */
    public static final int CHANGE_WRITER_CLASS = 1128679237;

    private LockKeys() {}

    public static long hash(String name) {
        long h = FNV_OFFSET;
        for (byte b : name.getBytes(StandardCharsets.UTF_8)) {
            h ^= (b & 0xFF);
            h *= FNV_PRIME;
        }
        return h;
    }

    /** Writer lock: blocking writers and outbox folding. */
    public static long shard(String feedId, int shardId) {
        return hash("changefeed/shard/" + feedId + "/" + shardId);
    }

    /** Held for the duration of one sweep transaction. */
    public static long sweep(int sweepGroup) {
        return hash("changefeed/sweep/" + sweepGroup);
    }

    /** Held by the session running the sweep loop of a group. */
    public static long sweepLoop(int sweepGroup) {
        return hash("changefeed/sweep-loop/" + sweepGroup);
    }

    /** Held exclusively by the sweep loop, waited on (shared) by longpollers. */
    public static long longpoll(String feedId, int shardId) {
        return hash("changefeed/longpoll/" + feedId + "/" + shardId);
    }

    public static long classId(long key) {
        return key >>> 32;
    }

    public static long objId(long key) {
        return key & 0xFFFF_FFFFL;
    }
}
