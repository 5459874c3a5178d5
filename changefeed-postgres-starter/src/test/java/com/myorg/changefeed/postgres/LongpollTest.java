package com.myorg.changefeed.postgres;

import com.myorg.changefeed.ChangeWriter;
import com.myorg.changefeed.FeedRegistry;
import com.myorg.changefeed.Longpoller;
import com.myorg.changefeed.SweepLoop;
import com.myorg.changefeed.contracts.core.exception.ChangefeedNonRetryableException;
import com.myorg.changefeed.contracts.core.exception.NoActiveSweeperException;
import com.myorg.changefeed.contracts.core.exception.UnknownShardException;
import com.myorg.changefeed.contracts.feed.FeedDefinition;
import com.myorg.changefeed.contracts.feed.FeedMode;
import com.myorg.changefeed.contracts.feed.LongpollOutcome;
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

import static com.myorg.changefeed.postgres.ChangefeedDb.BASE;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(
        classes = ChangefeedITApp.class,
        properties = "changefeed.sweep.scheduling-enabled=false"
)
class LongpollTest extends PostgresContainerBase {

    static final int GROUP = 11;

    @Autowired FeedRegistry feeds;
    @Autowired ChangeWriter writer;
    @Autowired SweepLoop loop;
    @Autowired Longpoller longpoller;
    @Autowired JdbcTemplate jdbc;

    final ExecutorService async = Executors.newCachedThreadPool();

    @BeforeEach
    void clean() {
        ChangefeedDb.truncateAll(jdbc);
        feeds.setupFeed(FeedDefinition.builder()
                .feedId("events").mode(FeedMode.SWEEP).sweepGroup(GROUP).longpoll(true).build());
        feeds.insertShard("events", 0);
    }

    @Test
    void staleSeenValue_returnsChangedAtOnce() {
        assertEquals(LongpollOutcome.CHANGED, longpoller.longpoll("events", 0, Duration.ofSeconds(5), BASE - 1));
    }

    @Test
    void unknownShard_isRejected() {
        assertThrows(UnknownShardException.class, () -> longpoller.longpoll("events", 99, Duration.ofMillis(100), BASE));
    }

    @Test
    void shardWithoutLongpoll_isRejectedEvenWhileLoopRuns() throws Exception {
        feeds.setupFeed(FeedDefinition.builder()
                .feedId("quiet").mode(FeedMode.SWEEP).sweepGroup(GROUP).longpoll(false).build());
        feeds.insertShard("quiet", 0);

        CompletableFuture<SweepLoopStats> running = startLoop(Duration.ofSeconds(2));
        try {
            ChangefeedNonRetryableException e = assertThrows(ChangefeedNonRetryableException.class,
                    () -> longpoller.longpoll("quiet", 0, Duration.ofMillis(300), BASE));
            assertEquals("LONGPOLL_DISABLED", e.getReason());
        } finally {
            assertTrue(running.get(10, TimeUnit.SECONDS).acquired());
        }
    }

    @Test
    void withoutSweepLoop_reportsNoActiveSweeper() {
        assertThrows(NoActiveSweeperException.class, () -> longpoller.longpoll("events", 0, Duration.ofMillis(200), BASE));
    }

    @Test
    void nothingHappens_timesOut() throws Exception {
        CompletableFuture<SweepLoopStats> running = startLoop(Duration.ofSeconds(3));
        try {
            long started = System.nanoTime();
            assertEquals(LongpollOutcome.TIMED_OUT, longpoller.longpoll("events", 0, Duration.ofMillis(300), BASE));
            assertTrue(Duration.ofNanos(System.nanoTime() - started).toMillis() >= 250);
        } finally {
            assertTrue(running.get(10, TimeUnit.SECONDS).acquired());
        }
    }

    @Test
    void sweepOfTheShard_wakesTheLongpoller() throws Exception {
        CompletableFuture<SweepLoopStats> running = startLoop(Duration.ofSeconds(4));
        try {
            CompletableFuture<LongpollOutcome> polling = CompletableFuture.supplyAsync(
                    () -> longpoller.longpoll("events", 0, Duration.ofSeconds(5), BASE), async);

            await().atMost(Duration.ofSeconds(3)).until(this::someoneWaitsOnAdvisoryLock);
            writer.append("events", 0, Map.of("hello", "world"));

            LongpollOutcome outcome = polling.get(5, TimeUnit.SECONDS);
            assertTrue(outcome == LongpollOutcome.SIGNALLED || outcome == LongpollOutcome.CHANGED, "outcome=" + outcome);
            assertEquals(BASE + 1, ChangefeedDb.lastSequenceNumber(jdbc, "events", 0));
        } finally {
            running.get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    void manyLongpollers_allWakeOnOneSweep() throws Exception {
        CompletableFuture<SweepLoopStats> running = startLoop(Duration.ofSeconds(4));
        try {
            CompletableFuture<?>[] polls = new CompletableFuture<?>[3];
            for (int i = 0; i < polls.length; i++) {
                polls[i] = CompletableFuture.supplyAsync(
                        () -> longpoller.longpoll("events", 0, Duration.ofSeconds(5), BASE), async);
            }
            await().atMost(Duration.ofSeconds(3)).until(() -> waiters() >= polls.length);
            writer.append("events", 0, Map.of("n", 1));

            for (CompletableFuture<?> p : polls) {
                assertNotEquals(LongpollOutcome.TIMED_OUT, p.get(5, TimeUnit.SECONDS));
            }
        } finally {
            running.get(10, TimeUnit.SECONDS);
        }
    }

    private CompletableFuture<SweepLoopStats> startLoop(Duration duration) {
        CompletableFuture<SweepLoopStats> running = CompletableFuture.supplyAsync(
                () -> loop.run(GROUP, Duration.ofSeconds(1), duration, Duration.ofMillis(10)), async);
        await().atMost(Duration.ofSeconds(5)).until(() -> PgLocks.isHeld(jdbc, LockKeys.longpoll("events", 0)));
        return running;
    }

    private boolean someoneWaitsOnAdvisoryLock() {
        return waiters() > 0;
    }

    private int waiters() {
        Integer n = jdbc.queryForObject(
                "select count(*) from pg_locks where locktype = 'advisory' and not granted", Integer.class);
        return n == null ? 0 : n;
    }
}
