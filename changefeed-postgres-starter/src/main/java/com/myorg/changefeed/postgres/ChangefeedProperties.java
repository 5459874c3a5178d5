package com.myorg.changefeed.postgres;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "changefeed")
public class ChangefeedProperties {

    private boolean enabled = true;

    private Sweep sweep = new Sweep();
    private Lock lock = new Lock();
    private Longpoll longpoll = new Longpoll();
    private Read read = new Read();
    private Outbox outbox = new Outbox();
    private Metrics metrics = new Metrics();

    @Data
    public static class Sweep {
        private int batchSize = 1000;
        /** How long a sweep waits for open change inserts of its group before giving up. */
        private Duration writerWait = Duration.ofSeconds(2);

        // arguments of each scheduled SweepLoop.run
        private Duration sleep = Duration.ofMillis(5);
        private Duration wait = Duration.ofSeconds(1);
        private Duration duration = Duration.ofSeconds(10);
        private List<Integer> groups = new ArrayList<>(List.of(0));

        private boolean schedulingEnabled = false;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration fixedDelay = Duration.ofMillis(100);
    }

    @Data
    public static class Lock {
        /** lock_timeout of a single acquire attempt; the holder is inspected after each one. */
        private Duration attemptTimeout = Duration.ofMillis(250);
        /** Total time to wait behind a live holder before giving up. */
        private Duration waitTimeout = Duration.ofSeconds(10);
        private int maxIncidentRetries = 10;

        /** A holder idle in transaction this long is considered abandoned. */
        private Duration incidentIdleThreshold = Duration.ofSeconds(2);
        /** A holder whose transaction is older than this is considered stuck, idle or not. */
        private Duration maxHold = Duration.ofSeconds(60);
    }

    @Data
    public static class Longpoll {
        private Duration guardInterval = Duration.ofMillis(5);
        private Duration guardTimeout = Duration.ofSeconds(2);
        /** Extra time allowed for the background wait to report after its timeout. */
        private Duration grace = Duration.ofSeconds(2);
    }

    @Data
    public static class Read {
        private int defaultPageSize = 100;
        private int maxPageSize = 1000;
    }

    @Data
    public static class Outbox {
        private int foldBatchSize = 1000;
    }

    @Data
    public static class Metrics {
        private boolean enabled = true;
    }
}
