package com.xbleey.signalalert.service;

import com.xbleey.signalalert.config.SignalSuppressionProperties;
import com.xbleey.signalalert.enums.RecurrenceTrend;
import com.xbleey.signalalert.enums.SignalSeverity;
import com.xbleey.signalalert.model.RecurrenceEntry;
import com.xbleey.signalalert.model.RecurrenceInfo;
import com.xbleey.signalalert.model.SignalKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling occurrence history per signal key. Trend compares a new impact score with the mean of
 * the scores already in the window, so {@link #getInfo} has to run before {@link #recordOccurrence}.
 */
@Component
public class SignalRecurrenceTracker implements SweepableState {

    private static final Logger log = LoggerFactory.getLogger(SignalRecurrenceTracker.class);

    private final Map<SignalKey, List<RecurrenceEntry>> occurrences = new ConcurrentHashMap<>();
    private final SignalSuppressionProperties properties;
    private final Clock clock;

    public SignalRecurrenceTracker(SignalSuppressionProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public RecurrenceInfo getInfo(SignalKey key, int impactScore) {
        Instant now = clock.instant();
        List<RecurrenceEntry> prior = occurrences.computeIfPresent(key, (ignored, entries) -> prune(entries, now));
        return describe(prior == null ? List.of() : prior, impactScore, now);
    }

    public void recordOccurrence(SignalKey key, SignalSeverity severity, int impactScore) {
        Instant now = clock.instant();
        List<RecurrenceEntry> updated = occurrences.compute(key, (ignored, entries) -> append(entries, severity, impactScore, now));
        log.debug("Recorded {} occurrence ({} in window)", key, updated == null ? 0 : updated.size());
    }

    public RecurrenceInfo observe(SignalKey key, SignalSeverity severity, int impactScore) {
        Instant now = clock.instant();
        RecurrenceInfo[] info = new RecurrenceInfo[1];
        occurrences.compute(key, (ignored, entries) -> {
            List<RecurrenceEntry> prior = entries == null ? List.of() : prune(entries, now);
            info[0] = describe(prior, impactScore, now);
            return append(prior, severity, impactScore, now);
        });
        return info[0];
    }

    public List<RecurrenceEntry> history(SignalKey key) {
        List<RecurrenceEntry> entries = occurrences.get(key);
        if (entries == null) {
            return List.of();
        }
        return prune(entries, clock.instant());
    }

    @Override
    public String stateName() {
        return "signalRecurrence";
    }

    @Override
    public int sweep(Instant now) {
        int removed = 0;
        for (SignalKey key : occurrences.keySet()) {
            boolean[] emptied = new boolean[1];
            occurrences.computeIfPresent(key, (ignored, entries) -> {
                List<RecurrenceEntry> kept = prune(entries, now);
                if (kept.isEmpty()) {
                    emptied[0] = true;
                    return null;
                }
                return kept;
            });
            if (emptied[0]) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return occurrences.size();
    }

    private RecurrenceInfo describe(List<RecurrenceEntry> prior, int impactScore, Instant now) {
        if (prior.isEmpty()) {
            return new RecurrenceInfo(1, RecurrenceTrend.NEW, false, null, null, null);
        }
        double mean = prior.stream().mapToInt(RecurrenceEntry::impactScore).average().orElse(impactScore);
        int margin = properties.getTrendMargin();
        RecurrenceTrend trend;
        if (impactScore - mean > margin) {
            trend = RecurrenceTrend.INCREASING;
        } else if (mean - impactScore > margin) {
            trend = RecurrenceTrend.DECREASING;
        } else {
            trend = RecurrenceTrend.STABLE;
        }
        RecurrenceEntry last = prior.get(prior.size() - 1);
        long secondsSinceLast = Math.max(0, Duration.between(last.timestamp(), now).getSeconds());
        return new RecurrenceInfo(prior.size() + 1, trend, true, last.impactScore(), last.timestamp(), secondsSinceLast);
    }

    private List<RecurrenceEntry> append(List<RecurrenceEntry> entries, SignalSeverity severity, int impactScore, Instant now) {
        List<RecurrenceEntry> updated = new ArrayList<>(entries == null ? List.of() : prune(entries, now));
        updated.add(new RecurrenceEntry(now, severity, impactScore));
        return List.copyOf(updated);
    }

    private List<RecurrenceEntry> prune(List<RecurrenceEntry> entries, Instant now) {
        Instant cutoff = now.minus(properties.getRecurrenceWindow());
        if (entries.isEmpty() || entries.get(0).timestamp().isAfter(cutoff)) {
            return entries;
        }
        return entries.stream()
                .filter(entry -> entry.timestamp().isAfter(cutoff))
                .toList();
    }
}
