package com.xbleey.signalalert.service;

import com.xbleey.signalalert.enums.CooldownDecision;
import com.xbleey.signalalert.enums.SignalSeverity;
import com.xbleey.signalalert.enums.SignalType;
import com.xbleey.signalalert.model.CooldownAdmission;
import com.xbleey.signalalert.model.SignalKey;
import com.xbleey.signalalert.support.MutableClock;
import com.xbleey.signalalert.support.SignalFixtures;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SignalCooldownTrackerTest {

    private final MutableClock clock = MutableClock.at("2026-03-02T10:00:00Z");
    private final SignalCooldownTracker tracker = new SignalCooldownTracker(SignalFixtures.suppressionProperties(), clock);
    private final SignalKey key = SignalKey.of(SignalFixtures.token(), SignalType.RISK);

    @Test
    void firstAdmissionStartsWindow() {
        CooldownAdmission admission = tracker.admit(key, SignalSeverity.DANGER);

        assertThat(admission.decision()).isEqualTo(CooldownDecision.STARTED);
        assertThat(admission.previousSeverity()).isNull();
        assertThat(admission.entry().expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(15)));
        assertThat(tracker.isActive(key)).isTrue();
    }

    @Test
    void sameOrLowerSeverityIsSuppressedInsideWindow() {
        tracker.admit(key, SignalSeverity.DANGER);
        clock.advance(Duration.ofMinutes(5));

        CooldownAdmission same = tracker.admit(key, SignalSeverity.DANGER);
        CooldownAdmission lower = tracker.admit(key, SignalSeverity.WARNING);

        assertThat(same.suppressed()).isTrue();
        assertThat(lower.suppressed()).isTrue();
        assertThat(same.entry().remainingSeconds(clock.instant())).isEqualTo(600);
    }

    @Test
    void higherSeverityReplacesWindow() {
        tracker.admit(key, SignalSeverity.WARNING);
        clock.advance(Duration.ofMinutes(2));

        CooldownAdmission admission = tracker.admit(key, SignalSeverity.CRITICAL);

        assertThat(admission.escalated()).isTrue();
        assertThat(admission.previousSeverity()).isEqualTo(SignalSeverity.WARNING);
        assertThat(admission.entry().startedAt()).isEqualTo(clock.instant());
        assertThat(admission.entry().expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(30)));
        assertThat(tracker.activeEntry(key)).get()
                .extracting(entry -> entry.lastSeverity())
                .isEqualTo(SignalSeverity.CRITICAL);
    }

    @Test
    void expiredWindowStartsOver() {
        tracker.admit(key, SignalSeverity.CRITICAL);
        clock.advance(Duration.ofMinutes(30));

        CooldownAdmission admission = tracker.admit(key, SignalSeverity.WARNING);

        assertThat(admission.decision()).isEqualTo(CooldownDecision.STARTED);
    }

    @Test
    void resetReplacesWindowFromNow() {
        tracker.start(key, SignalSeverity.WARNING);
        clock.advance(Duration.ofMinutes(9));

        tracker.reset(key, SignalSeverity.WARNING);

        assertThat(tracker.activeEntry(key)).get()
                .extracting(entry -> entry.expiresAt())
                .isEqualTo(clock.instant().plus(Duration.ofMinutes(10)));
    }

    @Test
    void keysAreIndependent() {
        SignalKey liquidity = SignalKey.of(SignalFixtures.token(), SignalType.LIQUIDITY);
        tracker.admit(key, SignalSeverity.CRITICAL);

        assertThat(tracker.admit(liquidity, SignalSeverity.WARNING).decision()).isEqualTo(CooldownDecision.STARTED);
    }

    @Test
    void sweepRemovesExpiredEntries() {
        tracker.admit(key, SignalSeverity.WARNING);
        clock.advance(Duration.ofMinutes(11));

        assertThat(tracker.sweep(clock.instant())).isEqualTo(1);
        assertThat(tracker.size()).isZero();
    }
}
