package com.demo.changefeed;

import com.myorg.changefeed.SweepLoop;
import com.myorg.changefeed.contracts.sweep.SweepLoopStats;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * Manual sweep, for running the demo without the scheduled sweep loop.
 * <p>
 * Runs a single pass of the sweep loop, so longpollers of swept shards are signalled. When another loop
 * owns the group the answer is {@code acquired=false} and that loop does the sweeping.
 */
@RestController
@RequiredArgsConstructor
public class SweepController {

    private static final Duration LOOP_WAIT = Duration.ofMillis(200);

    private final SweepLoop sweepLoop;

    @PostMapping("/sweeps/{group}")
    public SweepLoopStats sweep(@PathVariable("group") int group) {
        return ApiErrors.call(() -> sweepLoop.run(group, LOOP_WAIT, Duration.ZERO, Duration.ZERO));
    }
}
