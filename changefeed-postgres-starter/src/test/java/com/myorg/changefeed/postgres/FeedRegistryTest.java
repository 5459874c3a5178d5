package com.myorg.changefeed.postgres;

import com.myorg.changefeed.FeedRegistry;
import com.myorg.changefeed.contracts.core.exception.ChangefeedNonRetryableException;
import com.myorg.changefeed.contracts.core.exception.UnknownFeedException;
import com.myorg.changefeed.contracts.feed.FeedDefinition;
import com.myorg.changefeed.contracts.feed.FeedMode;
import com.myorg.changefeed.contracts.feed.ShardState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import static com.myorg.changefeed.postgres.ChangefeedDb.BASE;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(
        classes = ChangefeedITApp.class,
        properties = "changefeed.sweep.scheduling-enabled=false"
)
class FeedRegistryTest extends PostgresContainerBase {

    @Autowired FeedRegistry feeds;
    @Autowired JdbcTemplate jdbc;

    @BeforeEach
    void clean() {
        ChangefeedDb.truncateAll(jdbc);
    }

    @Test
    void setupFeed_isIdempotent() {
        FeedDefinition def = FeedDefinition.builder().feedId("orders").mode(FeedMode.SWEEP).sweepGroup(4).longpoll(true).build();

        FeedDefinition first = feeds.setupFeed(def);
        FeedDefinition again = feeds.setupFeed(def);

        assertEquals(first, again);
        assertEquals(4, again.getSweepGroup());
        assertTrue(again.isLongpoll());
    }

    @Test
    void setupFeed_withOtherMode_isRejected() {
        feeds.setupFeed(FeedDefinition.builder().feedId("orders").mode(FeedMode.SWEEP).build());

        ChangefeedNonRetryableException ex = assertThrows(ChangefeedNonRetryableException.class,
                () -> feeds.setupFeed(FeedDefinition.builder().feedId("orders").mode(FeedMode.OUTBOX).build()));
        assertEquals("FEED_MODE_CONFLICT", ex.getReason());
    }

    @Test
    void setupFeed_validatesInput() {
        assertThrows(IllegalArgumentException.class,
                () -> feeds.setupFeed(FeedDefinition.builder().feedId(" ").mode(FeedMode.SWEEP).build()));
        assertThrows(IllegalArgumentException.class,
                () -> feeds.setupFeed(FeedDefinition.builder().feedId("x").build()));
    }

    @Test
    void insertShard_inheritsFeedDefaults() {
        feeds.setupFeed(FeedDefinition.builder().feedId("orders").mode(FeedMode.SWEEP).sweepGroup(6).longpoll(true).build());
        feeds.insertShard("orders", 2);
        feeds.insertShard("orders", 2);

        ShardState shard = feeds.shard("orders", 2).orElseThrow();
        assertEquals(6, shard.sweepGroup());
        assertTrue(shard.longpoll());
        assertEquals(BASE, shard.lastSequenceNumber());
        assertNull(shard.lastSweepTime());
        assertEquals(0, feeds.incidentCount("orders", 2));
    }

    @Test
    void insertShard_ofUnknownFeed_isRejected() {
        assertThrows(UnknownFeedException.class, () -> feeds.insertShard("ghost", 0));
        assertTrue(feeds.shard("ghost", 0).isEmpty());
        assertTrue(feeds.findFeed("ghost").isEmpty());
    }
}
