package com.myorg.changefeed.contracts.feed;

public enum LongpollOutcome {
    /** The shard had already moved past the sequence number the caller has seen. */
    CHANGED,
    /** The sweep loop cycled the longpoll lock. */
    SIGNALLED,
    TIMED_OUT
}
