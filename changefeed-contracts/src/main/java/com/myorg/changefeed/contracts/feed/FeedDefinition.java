package com.myorg.changefeed.contracts.feed;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedDefinition {

    private String feedId;
    private FeedMode mode;

    // defaults copied to new shards
    @Builder.Default
    private int sweepGroup = 0;
    @Builder.Default
    private boolean longpoll = false;
}
