package com.myorg.changefeed.contracts.feed;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record FeedEntry(Cursor cursor, Instant time, JsonNode payload) {}
