package com.demo.changefeed;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.changefeed.contracts.feed.FeedEntry;
import com.myorg.changefeed.contracts.feed.FeedPage;

import java.time.Instant;
import java.util.List;

/**
 * JSON shapes of the demo API. Cursors travel as hex strings.
 */
public final class FeedViews {

    private FeedViews() {}

    public record EntryView(String cursor, Instant time, JsonNode payload) {
        static EntryView of(FeedEntry e) {
            return new EntryView(e.cursor().toHex(), e.time(), e.payload());
        }
    }

    public record PageView(List<EntryView> entries, String next) {
        static PageView of(FeedPage page) {
            return new PageView(page.entries().stream().map(EntryView::of).toList(), page.next().toHex());
        }
    }

    public record AppendedView(List<String> ids, boolean incidentDetected, int lockAttempts) {}

    public record IdView(long id) {}

    public record LongpollView(String outcome) {}
}
