package com.xbleey.signalalert.service;

import com.xbleey.signalalert.config.SignalSuppressionProperties;
import com.xbleey.signalalert.enums.CooldownDecision;
import com.xbleey.signalalert.enums.SignalSeverity;
import com.xbleey.signalalert.model.CooldownAdmission;
import com.xbleey.signalalert.model.CooldownEntry;
import com.xbleey.signalalert.model.SignalKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class SignalCooldownTracker implements SweepableState {

    private static final Logger log = LoggerFactory.getLogger(SignalCooldownTracker.class);

    private final Map<SignalKey, CooldownEntry> entries = new ConcurrentHashMap<>();
    private final SignalSuppressionProperties properties;
    private final Clock clock;

    public SignalCooldownTracker(SignalSuppressionProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    boolean isActive(SignalKey key) {
        return activeEntry(key).isPresent();
    }

    public Optional<CooldownEntry> activeEntry(SignalKey key) {
        Instant now = clock.instant();
        CooldownEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isActive(now)) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    CooldownEntry start(SignalKey key, SignalSeverity severity) {
        CooldownEntry entry = newEntry(severity, clock.instant());
        entries.put(key, entry);
        return entry;
    }

    CooldownEntry reset(SignalKey key, SignalSeverity severity) {
        CooldownEntry entry = start(key, severity);
        log.info("Cooldown reset for {} at severity {}", key, severity.code());
        return entry;
    }

    public CooldownAdmission admit(SignalKey key, SignalSeverity severity) {
        Instant now = clock.instant();
        CooldownAdmission[] outcome = new CooldownAdmission[1];
        entries.compute(key, (ignored, current) -> {
            if (current == null || !current.isActive(now)) {
                CooldownEntry created = newEntry(severity, now);
                outcome[0] = new CooldownAdmission(CooldownDecision.STARTED, null, created);
                return created;
            }
            if (severity.isHigherThan(current.lastSeverity())) {
                CooldownEntry escalated = newEntry(severity, now);
                outcome[0] = new CooldownAdmission(CooldownDecision.ESCALATED, current.lastSeverity(), escalated);
                return escalated;
            }
            outcome[0] = new CooldownAdmission(CooldownDecision.SUPPRESSED, current.lastSeverity(), current);
            return current;
        });
        CooldownAdmission admission = outcome[0];
        if (admission.escalated()) {
            log.info("Cooldown escalated for {}: {} -> {}",
                    key, admission.previousSeverity().code(), severity.code());
        }
        return admission;
    }

    @Override
    public String stateName() {
        return "signalCooldown";
    }

    @Override
    public int sweep(Instant now) {
        int removed = 0;
        for (Map.Entry<SignalKey, CooldownEntry> entry : entries.entrySet()) {
            if (!entry.getValue().isActive(now) && entries.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return entries.size();
    }

    private CooldownEntry newEntry(SignalSeverity severity, Instant now) {
        Duration window = properties.cooldownFor(severity);
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalStateException("No cooldown configured for severity " + severity);
        }
        return new CooldownEntry(now, now.plus(window), severity);
    }
}
