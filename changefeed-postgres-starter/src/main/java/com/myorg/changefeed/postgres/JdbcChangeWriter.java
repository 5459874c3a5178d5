package com.myorg.changefeed.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.changefeed.ChangeWriter;
import com.myorg.changefeed.FeedRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;

@RequiredArgsConstructor
public class JdbcChangeWriter implements ChangeWriter {

    private final JdbcTemplate jdbc;
    private final FeedRegistry feeds;
    private final ObjectMapper mapper;

    @Override
    public long append(String feedId, int shardId, Object payload) {
        if (feedId == null || feedId.isBlank()) throw new IllegalArgumentException("feedId must not be blank");
        if (payload == null) throw new IllegalArgumentException("payload must not be null");

        String json = toJson(mapper, payload);
        feeds.insertShard(feedId, shardId);

        Long id = jdbc.queryForObject("""
                INSERT INTO changefeed.change (feed_id, shard_id, payload)
                VALUES (?, ?, CAST(? AS jsonb))
                RETURNING change_id
                """, Long.class, feedId, shardId, json);

        if (id == null) throw new IllegalStateException("No change_id returned from insert");
        return id;
    }

    static String toJson(ObjectMapper mapper, Object payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize payload", e);
        }
    }
}
