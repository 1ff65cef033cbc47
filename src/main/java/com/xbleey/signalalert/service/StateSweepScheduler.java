package com.xbleey.signalalert.service;

import com.xbleey.signalalert.model.SweepReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class StateSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(StateSweepScheduler.class);

    private final List<SweepableState> states;
    private final Clock clock;
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final Object lock = new Object();
    private SweepReport lastReport;

    public StateSweepScheduler(List<SweepableState> states, Clock clock) {
        this.states = List.copyOf(states);
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "#{@signalSuppressionProperties.sweepInterval.toMillis()}",
            initialDelayString = "#{@signalSuppressionProperties.sweepInterval.toMillis()}"
    )
    public void scheduledSweep() {
        if (paused.get()) {
            log.debug("Skip sweep: paused");
            return;
        }
        runNow();
    }

    public SweepReport runNow() {
        synchronized (lock) {
            Instant now = clock.instant();
            Map<String, Integer> removed = new LinkedHashMap<>();
            Map<String, Integer> remaining = new LinkedHashMap<>();
            for (SweepableState state : states) {
                try {
                    removed.put(state.stateName(), state.sweep(now));
                } catch (Exception ex) {
                    log.warn("Failed to sweep {}", state.stateName(), ex);
                    removed.put(state.stateName(), 0);
                }
                remaining.put(state.stateName(), state.size());
            }
            SweepReport report = new SweepReport(now, Collections.unmodifiableMap(removed), Collections.unmodifiableMap(remaining));
            lastReport = report;
            if (report.totalRemoved() > 0) {
                log.info("Swept {} stale entries: {}", report.totalRemoved(), removed);
            }
            return report;
        }
    }

    public void pause() {
        if (paused.compareAndSet(false, true)) {
            log.info("State sweep paused");
        }
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) {
            log.info("State sweep resumed");
        }
    }

    public boolean isPaused() {
        return paused.get();
    }

    public Optional<SweepReport> lastReport() {
        synchronized (lock) {
            return Optional.ofNullable(lastReport);
        }
    }

    public List<String> stateNames() {
        return states.stream().map(SweepableState::stateName).toList();
    }
}
