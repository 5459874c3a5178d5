package com.myorg.changefeed.contracts.sweep;

/**
 * A change selected by a sweep, with its 1-based position among the selected rows of its shard.
 */
public record UnsweptChange(long changeId, String feedId, int shardId, long rank) {}
