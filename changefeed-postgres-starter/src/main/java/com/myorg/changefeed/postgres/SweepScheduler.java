package com.myorg.changefeed.postgres;

import com.myorg.changefeed.SweepLoop;
import com.myorg.changefeed.contracts.sweep.SweepLoopStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Keeps a sweep loop running for each configured group. Every tick runs {@link SweepLoop#run}
 * once per group; when another instance already owns a group the call returns after {@code wait}.
 */
@Slf4j
@RequiredArgsConstructor
public class SweepScheduler {

    private final ChangefeedProperties props;
    private final SweepLoop sweepLoop;

    @Scheduled(
            initialDelayString = "#{@changefeedSchedule.initialDelayMs}",
            fixedDelayString = "#{@changefeedSchedule.fixedDelayMs}"
    )
    public void scheduledLoop() {
        if (!props.getSweep().isSchedulingEnabled()) return;
        runOnce();
    }

    public void runOnce() {
        ChangefeedProperties.Sweep cfg = props.getSweep();
        for (Integer group : cfg.getGroups()) {
            try {
                SweepLoopStats stats = sweepLoop.run(group, cfg.getWait(), cfg.getDuration(), cfg.getSleep());
                if (stats.acquired()) {
                    log.debug("Changefeed sweep loop finished group={} iterations={} assigned={} races={}",
                            group, stats.iterations(), stats.changesAssigned(), stats.races());
                }
            } catch (RuntimeException e) {
                log.warn("Changefeed sweep loop FAILED group={}", group, e);
            }
        }
    }
}
