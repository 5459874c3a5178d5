package com.myorg.changefeed.postgres;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class ChangefeedScheduleValues {
    private final ChangefeedProperties props;

    public long getFixedDelayMs() { return props.getSweep().getFixedDelay().toMillis(); }
    public long getInitialDelayMs() { return props.getSweep().getInitialDelay().toMillis(); }
}
