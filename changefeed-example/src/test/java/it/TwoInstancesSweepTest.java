package it;

import com.demo.changefeed.ChangefeedExampleApplication;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Two app instances share one database: only one of them sweeps a group at a time, and both
 * serve the same numbering.
 */
class TwoInstancesSweepTest extends AbstractIntegrationTest {

    private final RestTemplate rest = new RestTemplate();

    @Test
    void writesThroughBoth_areNumberedWithoutGapOrRepeat() {
        try (AppInstance a = new AppInstance(ChangefeedExampleApplication.class, "sweep-a");
             AppInstance b = new AppInstance(ChangefeedExampleApplication.class, "sweep-b")) {

            String feed = "orders-" + UUID.randomUUID();
            rest.postForObject(a.url("/feeds"),
                    Map.of("feedId", feed, "mode", "SWEEP", "sweepGroup", 0, "longpoll", false), JsonNode.class);

            for (int i = 0; i < 20; i++) {
                AppInstance target = i % 2 == 0 ? a : b;
                rest.postForObject(target.url("/feeds/" + feed + "/shards/0/changes"), Map.of("i", i), JsonNode.class);
            }

            JdbcTemplate jdbc = a.getBean(JdbcTemplate.class);
            await().atMost(Duration.ofSeconds(15)).until(() -> unswept(jdbc, feed) == 0);

            List<Long> seq = jdbc.queryForList("""
                    select change_sequence_number from changefeed.change
                     where feed_id = ? order by change_sequence_number
                    """, Long.class, feed);
            assertEquals(20, seq.size());
            for (int i = 1; i < seq.size(); i++) {
                assertEquals(seq.get(i - 1) + 1, seq.get(i));
            }

            JsonNode fromB = rest.getForObject(b.url("/feeds/" + feed + "/shards/0?pageSize=100"), JsonNode.class);
            assertEquals(20, fromB.get("entries").size());
        }
    }

    private static long unswept(JdbcTemplate jdbc, String feed) {
        Long n = jdbc.queryForObject(
                "select count(*) from changefeed.change where feed_id = ? and change_sequence_number is null",
                Long.class, feed);
        return n == null ? 0 : n;
    }
}
