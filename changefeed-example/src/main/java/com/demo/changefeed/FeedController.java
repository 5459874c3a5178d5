package com.demo.changefeed;

import com.demo.changefeed.FeedViews.AppendedView;
import com.demo.changefeed.FeedViews.IdView;
import com.demo.changefeed.FeedViews.LongpollView;
import com.demo.changefeed.FeedViews.PageView;
import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.changefeed.ChangeWriter;
import com.myorg.changefeed.ChangefeedTransaction;
import com.myorg.changefeed.ChangefeedTransactions;
import com.myorg.changefeed.FeedReader;
import com.myorg.changefeed.FeedRegistry;
import com.myorg.changefeed.Longpoller;
import com.myorg.changefeed.OutboxWriter;
import com.myorg.changefeed.contracts.feed.Cursor;
import com.myorg.changefeed.contracts.feed.FeedDefinition;
import com.myorg.changefeed.contracts.feed.ShardState;
import com.myorg.changefeed.contracts.ulid.Ulid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/feeds")
@RequiredArgsConstructor
public class FeedController {

    private final FeedRegistry feeds;
    private final ChangeWriter changeWriter;
    private final OutboxWriter outboxWriter;
    private final ChangefeedTransactions transactions;
    private final FeedReader reader;
    private final Longpoller longpoller;

    @PostMapping
    public FeedDefinition setupFeed(@RequestBody FeedDefinition feed) {
        return ApiErrors.call(() -> feeds.setupFeed(feed));
    }

    @GetMapping("/{feedId}/shards/{shardId}/state")
    public ShardState shard(@PathVariable("feedId") String feedId, @PathVariable("shardId") int shardId) {
        return feeds.shard(feedId, shardId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Unknown shard " + feedId + "/" + shardId));
    }

    /** SWEEP feeds: the change becomes readable once a sweep numbers it. */
    @PostMapping("/{feedId}/shards/{shardId}/changes")
    @Transactional
    public IdView appendChange(@PathVariable("feedId") String feedId,
                               @PathVariable("shardId") int shardId,
                               @RequestBody JsonNode payload) {
        return new IdView(ApiErrors.call(() -> changeWriter.append(feedId, shardId, payload)));
    }

    @PostMapping("/{feedId}/shards/{shardId}/outbox")
    @Transactional
    public IdView appendOutbox(@PathVariable("feedId") String feedId,
                               @PathVariable("shardId") int shardId,
                               @RequestParam(name = "timeHint", required = false) Instant timeHint,
                               @RequestBody JsonNode payload) {
        return new IdView(ApiErrors.call(() -> outboxWriter.append(feedId, shardId, timeHint, payload)));
    }

    /** BLOCKING feeds: all payloads in one writer transaction, ids are consecutive. */
    @PostMapping("/{feedId}/shards/{shardId}/entries")
    public AppendedView appendEntries(@PathVariable("feedId") String feedId,
                                      @PathVariable("shardId") int shardId,
                                      @RequestParam(name = "timeHint", required = false) Instant timeHint,
                                      @RequestBody List<JsonNode> payloads) {
        return ApiErrors.call(() -> {
            try (ChangefeedTransaction tx = transactions.begin(feedId, shardId, timeHint)) {
                List<String> ids = new ArrayList<>(payloads.size());
                for (JsonNode p : payloads) {
                    Ulid id = tx.append(p);
                    ids.add(id.toString());
                }
                tx.commit();
                if (tx.lockResult().incidentDetected()) {
                    log.warn("Writer on feedId={} shardId={} replaced a stuck writer, incidentCount={}",
                            feedId, shardId, tx.lockResult().incidentCount());
                }
                return new AppendedView(ids, tx.lockResult().incidentDetected(), tx.lockResult().attempts());
            }
        });
    }

    @GetMapping("/{feedId}/shards/{shardId}")
    public PageView read(@PathVariable("feedId") String feedId,
                         @PathVariable("shardId") int shardId,
                         @RequestParam(name = "cursor", required = false) String cursor,
                         @RequestParam(name = "pageSize", defaultValue = "0") int pageSize) {
        return ApiErrors.call(() -> PageView.of(reader.readFeed(feedId, shardId, Cursor.fromHex(cursor), pageSize)));
    }

    @GetMapping("/{feedId}/shards/{shardId}/longpoll")
    public LongpollView longpoll(@PathVariable("feedId") String feedId,
                                 @PathVariable("shardId") int shardId,
                                 @RequestParam("seen") long seen,
                                 @RequestParam(name = "timeoutMs", defaultValue = "10000") long timeoutMs) {
        return ApiErrors.call(() -> new LongpollView(
                longpoller.longpoll(feedId, shardId, Duration.ofMillis(timeoutMs), seen).name()));
    }
}
