package com.xbleey.signalalert.service;

import com.xbleey.signalalert.config.TelegramProperties;
import com.xbleey.signalalert.enums.ImpactLevel;
import com.xbleey.signalalert.enums.SignalType;
import com.xbleey.signalalert.support.MutableClock;
import com.xbleey.signalalert.support.SignalFixtures;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationCooldownTrackerTest {

    private final MutableClock clock = MutableClock.at("2026-03-02T10:00:00Z");
    private final NotificationCooldownTracker tracker = new NotificationCooldownTracker(new TelegramProperties(), clock);
    private final String key = NotificationCooldownTracker.key(SignalFixtures.WALLET, SignalFixtures.token(), SignalType.RISK);

    @Test
    void keyIsLowercased() {
        assertThat(key).isEqualTo("0xabcdef0000000000000000000000000000000001:1:"
                + SignalFixtures.TOKEN + ":risk");
    }

    @Test
    void noEntryMeansNoCooldown() {
        assertThat(tracker.remainingSeconds(key, ImpactLevel.MEDIUM)).isEmpty();
    }

    @Test
    void sameLevelInsideWindowIsCoolingDown() {
        tracker.record(key, ImpactLevel.MEDIUM);
        clock.advance(Duration.ofMinutes(2));

        assertThat(tracker.remainingSeconds(key, ImpactLevel.MEDIUM)).hasValue(180);
        assertThat(tracker.remainingSeconds(key, ImpactLevel.LOW)).hasValue(180);
    }

    @Test
    void higherLevelBypassesWindow() {
        tracker.record(key, ImpactLevel.MEDIUM);
        clock.advance(Duration.ofMinutes(2));

        assertThat(tracker.remainingSeconds(key, ImpactLevel.HIGH)).isEmpty();
    }

    @Test
    void windowEndsAfterFiveMinutes() {
        tracker.record(key, ImpactLevel.HIGH);
        clock.advance(Duration.ofMinutes(5));

        assertThat(tracker.remainingSeconds(key, ImpactLevel.HIGH)).isEmpty();
    }

    @Test
    void sweepKeepsEntriesForTwoWindows() {
        tracker.record(key, ImpactLevel.HIGH);
        clock.advance(Duration.ofMinutes(10));
        assertThat(tracker.sweep(clock.instant())).isZero();

        clock.advance(Duration.ofSeconds(1));
        assertThat(tracker.sweep(clock.instant())).isEqualTo(1);
    }
}
