package it;

import com.demo.changefeed.ChangefeedExampleApplication;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class ChangefeedApiTest extends AbstractIntegrationTest {

    private final RestTemplate rest = new RestTemplate();

    @Test
    void sweepFeed_changesBecomeReadableInOrder() {
        try (AppInstance app = new AppInstance(ChangefeedExampleApplication.class, "api-sweep")) {
            String feed = "orders-" + UUID.randomUUID();
            createFeed(app, feed, "SWEEP", true);

            for (int i = 0; i < 3; i++) {
                rest.postForObject(app.url("/feeds/" + feed + "/shards/0/changes"), Map.of("n", i), JsonNode.class);
            }

            await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
                JsonNode page = rest.getForObject(app.url("/feeds/" + feed + "/shards/0"), JsonNode.class);
                assertEquals(3, page.get("entries").size());
            });

            JsonNode page = rest.getForObject(app.url("/feeds/" + feed + "/shards/0?pageSize=2"), JsonNode.class);
            assertEquals(2, page.get("entries").size());
            assertEquals(0, page.get("entries").get(0).get("payload").get("n").asInt());

            JsonNode rest2 = rest.getForObject(
                    app.url("/feeds/" + feed + "/shards/0?cursor=" + page.get("next").asText()), JsonNode.class);
            assertEquals(1, rest2.get("entries").size());
            assertEquals(2, rest2.get("entries").get(0).get("payload").get("n").asInt());
        }
    }

    @Test
    void longpoll_wakesWhenTheShardIsSwept() throws Exception {
        ExecutorService async = Executors.newSingleThreadExecutor();
        try (AppInstance app = new AppInstance(ChangefeedExampleApplication.class, "api-longpoll")) {
            String feed = "events-" + UUID.randomUUID();
            createFeed(app, feed, "SWEEP", true);
            rest.postForObject(app.url("/feeds/" + feed + "/shards/0/changes"), Map.of("n", 0), JsonNode.class);

            await().atMost(Duration.ofSeconds(10)).until(() -> {
                JsonNode page = rest.getForObject(app.url("/feeds/" + feed + "/shards/0"), JsonNode.class);
                return page.get("entries").size() == 1;
            });
            long seen = rest.getForObject(app.url("/feeds/" + feed + "/shards/0/state"), JsonNode.class)
                    .get("lastSequenceNumber").asLong();

            CompletableFuture<JsonNode> polling = CompletableFuture.supplyAsync(() -> rest.getForObject(
                    app.url("/feeds/" + feed + "/shards/0/longpoll?seen=" + seen + "&timeoutMs=8000"), JsonNode.class), async);
            Thread.sleep(300);
            rest.postForObject(app.url("/feeds/" + feed + "/shards/0/changes"), Map.of("n", 1), JsonNode.class);

            String outcome = polling.get(15, TimeUnit.SECONDS).get("outcome").asText();
            assertTrue(List.of("SIGNALLED", "CHANGED").contains(outcome), "outcome=" + outcome);
        } finally {
            async.shutdownNow();
        }
    }

    @Test
    void blockingFeed_writerIdsAreConsecutive() {
        try (AppInstance app = new AppInstance(ChangefeedExampleApplication.class, "api-blocking")) {
            String feed = "ledger-" + UUID.randomUUID();
            createFeed(app, feed, "BLOCKING", false);

            JsonNode appended = rest.postForObject(app.url("/feeds/" + feed + "/shards/1/entries"),
                    List.of(Map.of("a", 1), Map.of("b", 2)), JsonNode.class);
            assertEquals(2, appended.get("ids").size());
            assertFalse(appended.get("incidentDetected").asBoolean());

            JsonNode page = rest.getForObject(app.url("/feeds/" + feed + "/shards/1"), JsonNode.class);
            assertEquals(2, page.get("entries").size());
            assertTrue(page.get("entries").get(1).get("payload").has("b"));
        }
    }

    @Test
    void outboxFeed_isFoldedOnRead() {
        try (AppInstance app = new AppInstance(ChangefeedExampleApplication.class, "api-outbox")) {
            String feed = "audit-" + UUID.randomUUID();
            createFeed(app, feed, "OUTBOX", false);

            List<String> hints = List.of("2024-01-01T00:00:05Z", "2024-01-01T00:00:01Z");
            for (String hint : hints) {
                rest.postForObject(app.url("/feeds/" + feed + "/shards/0/outbox?timeHint=" + hint),
                        Map.of("hint", hint), JsonNode.class);
            }

            JsonNode page = rest.getForObject(app.url("/feeds/" + feed + "/shards/0"), JsonNode.class);
            List<String> times = new ArrayList<>();
            page.get("entries").forEach(e -> times.add(e.get("time").asText()));
            assertEquals(List.of("2024-01-01T00:00:05Z", "2024-01-01T00:00:05Z"), times);
        }
    }

    @Test
    void manualSweep_runsOneLoopPass() {
        try (AppInstance app = new AppInstance(ChangefeedExampleApplication.class, "api-manual-sweep",
                "--changefeed.sweep.scheduling-enabled=false")) {
            String feed = "orders-" + UUID.randomUUID();
            createFeed(app, feed, "SWEEP", true);
            rest.postForObject(app.url("/feeds/" + feed + "/shards/0/changes"), Map.of("n", 0), JsonNode.class);

            JsonNode stats = rest.postForObject(app.url("/sweeps/0"), null, JsonNode.class);
            assertTrue(stats.get("acquired").asBoolean());
            assertEquals(1, stats.get("iterations").asInt());
            assertTrue(stats.get("changesAssigned").asLong() >= 1);

            JsonNode page = rest.getForObject(app.url("/feeds/" + feed + "/shards/0"), JsonNode.class);
            assertEquals(1, page.get("entries").size());
        }
    }

    @Test
    void errors_mapToHttpStatuses() {
        try (AppInstance app = new AppInstance(ChangefeedExampleApplication.class, "api-errors")) {
            assertThrows(HttpClientErrorException.NotFound.class,
                    () -> rest.getForObject(app.url("/feeds/missing-" + UUID.randomUUID() + "/shards/0"), JsonNode.class));

            String feed = "orders-" + UUID.randomUUID();
            createFeed(app, feed, "SWEEP", false);
            assertThrows(HttpClientErrorException.BadRequest.class,
                    () -> rest.getForObject(app.url("/feeds/" + feed + "/shards/0?cursor=zz"), JsonNode.class));
            assertThrows(HttpClientErrorException.Conflict.class,
                    () -> createFeed(app, feed, "OUTBOX", false));
        }
    }

    private void createFeed(AppInstance app, String feedId, String mode, boolean longpoll) {
        rest.postForObject(app.url("/feeds"),
                Map.of("feedId", feedId, "mode", mode, "sweepGroup", 0, "longpoll", longpoll), JsonNode.class);
    }
}
