package com.myorg.changefeed.postgres;

import com.myorg.changefeed.SweepLoop;
import com.myorg.changefeed.contracts.sweep.SweepLoopStats;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SweepSchedulerTest {

    @Test
    void runOnce_visitsEveryGroup_evenAfterFailure() {
        ChangefeedProperties props = new ChangefeedProperties();
        props.getSweep().setGroups(List.of(1, 2, 3));

        List<Integer> visited = new ArrayList<>();
        SweepLoop loop = (group, wait, duration, sleep) -> {
            visited.add(group);
            if (group == 2) throw new IllegalStateException("database down");
            return new SweepLoopStats(true, 1, 0, 0, 0);
        };

        new SweepScheduler(props, loop).runOnce();

        assertEquals(List.of(1, 2, 3), visited);
    }

    @Test
    void scheduledTick_isNoOpWhenDisabled() {
        ChangefeedProperties props = new ChangefeedProperties();
        List<Integer> visited = new ArrayList<>();
        SweepLoop loop = (group, wait, duration, sleep) -> {
            visited.add(group);
            return SweepLoopStats.notAcquired();
        };

        new SweepScheduler(props, loop).scheduledLoop();
        assertTrue(visited.isEmpty());

        props.getSweep().setSchedulingEnabled(true);
        new SweepScheduler(props, loop).scheduledLoop();
        assertEquals(List.of(0), visited);
    }
}
