package com.myorg.changefeed;

/**
 * Writer for {@code SWEEP} feeds. Joins the caller's transaction; the change gets its
 * sequence number from a later sweep.
 */
public interface ChangeWriter {
    long append(String feedId, int shardId, Object payload);
}
