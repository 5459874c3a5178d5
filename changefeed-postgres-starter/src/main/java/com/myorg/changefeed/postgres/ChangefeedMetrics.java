package com.myorg.changefeed.postgres;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class ChangefeedMetrics {

    private final MeterRegistry registry;
    private final JdbcFeedRegistry feeds;

    private Counter assigned;
    private Counter races;
    private Counter incidents;
    private Counter longpollTimeouts;
    private Counter noSweeper;

    public void preRegister() {
        assigned = Counter.builder("changefeed.sweep.assigned").register(registry);
        races = Counter.builder("changefeed.sweep.races").register(registry);
        incidents = Counter.builder("changefeed.lock.incidents").register(registry);
        longpollTimeouts = Counter.builder("changefeed.longpoll.timeouts").register(registry);
        noSweeper = Counter.builder("changefeed.longpoll.no_sweeper").register(registry);

        registry.gauge("changefeed.unswept", feeds, JdbcFeedRegistry::countUnswept);
    }

    public void incAssigned(long n) { if (assigned != null) assigned.increment(n); }
    public void incRaces() { if (races != null) races.increment(); }
    public void incIncidents() { if (incidents != null) incidents.increment(); }
    public void incLongpollTimeouts() { if (longpollTimeouts != null) longpollTimeouts.increment(); }
    public void incNoSweeper() { if (noSweeper != null) noSweeper.increment(); }
}
