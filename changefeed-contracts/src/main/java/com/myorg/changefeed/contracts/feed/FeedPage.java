package com.myorg.changefeed.contracts.feed;

import java.util.List;

/**
 * One page of a feed. {@code next} is the cursor to pass to the following read;
 * it equals the input cursor when the page is empty.
 */
public record FeedPage(List<FeedEntry> entries, Cursor next) {

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
