package com.myorg.changefeed.postgres;

import com.myorg.changefeed.ChangeWriter;
import com.myorg.changefeed.FeedRegistry;
import com.myorg.changefeed.SweepLoop;
import com.myorg.changefeed.contracts.feed.FeedDefinition;
import com.myorg.changefeed.contracts.feed.FeedMode;
import com.myorg.changefeed.contracts.sweep.SweepLoopStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(
        classes = ChangefeedITApp.class,
        properties = "changefeed.sweep.scheduling-enabled=false"
)
class SweepLoopTest extends PostgresContainerBase {

    @Autowired FeedRegistry feeds;
    @Autowired ChangeWriter writer;
    @Autowired SweepLoop loop;
    @Autowired JdbcTemplate jdbc;

    final ExecutorService async = Executors.newCachedThreadPool();

    @BeforeEach
    void clean() {
        ChangefeedDb.truncateAll(jdbc);
    }

    @Test
    void loop_sweepsUntilDurationEnds() {
        feeds.setupFeed(FeedDefinition.builder().feedId("orders").mode(FeedMode.SWEEP).sweepGroup(7).build());
        for (int i = 0; i < 5; i++) writer.append("orders", 0, Map.of("n", i));

        SweepLoopStats stats = loop.run(7, Duration.ofSeconds(1), Duration.ofMillis(200), Duration.ofMillis(10));

        assertTrue(stats.acquired());
        assertTrue(stats.iterations() >= 2, "iterations=" + stats.iterations());
        assertEquals(5, stats.changesAssigned());
        assertEquals(0, stats.races());
        assertEquals(0, ChangefeedDb.unswept(jdbc, "orders", 0));
    }

    @Test
    void secondLoopOnSameGroup_isNotAcquired() throws Exception {
        CompletableFuture<SweepLoopStats> first = CompletableFuture.supplyAsync(
                () -> loop.run(8, Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofMillis(10)), async);

        await().atMost(Duration.ofSeconds(5))
                .until(() -> PgLocks.isHeld(jdbc, LockKeys.sweepLoop(8)));

        SweepLoopStats second = loop.run(8, Duration.ofMillis(100), Duration.ofSeconds(1), Duration.ofMillis(10));
        assertFalse(second.acquired());
        assertEquals(0, second.iterations());

        assertTrue(first.get(10, TimeUnit.SECONDS).acquired());
        assertFalse(PgLocks.isHeld(jdbc, LockKeys.sweepLoop(8)), "loop lock is released when the loop ends");
    }

    @Test
    void loopsOnDifferentGroups_runSideBySide() throws Exception {
        CompletableFuture<SweepLoopStats> a = CompletableFuture.supplyAsync(
                () -> loop.run(9, Duration.ofSeconds(1), Duration.ofMillis(300), Duration.ofMillis(10)), async);
        CompletableFuture<SweepLoopStats> b = CompletableFuture.supplyAsync(
                () -> loop.run(10, Duration.ofSeconds(1), Duration.ofMillis(300), Duration.ofMillis(10)), async);

        assertTrue(a.get(10, TimeUnit.SECONDS).acquired());
        assertTrue(b.get(10, TimeUnit.SECONDS).acquired());
    }
}
