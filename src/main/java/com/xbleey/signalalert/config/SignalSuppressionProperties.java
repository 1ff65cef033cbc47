package com.xbleey.signalalert.config;

import com.xbleey.signalalert.enums.SignalSeverity;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Data
@Component
@ConfigurationProperties(prefix = "signal.suppression")
public class SignalSuppressionProperties {

    private Map<SignalSeverity, Duration> cooldowns = defaultCooldowns();
    private Duration dedupWindow = Duration.ofMinutes(5);
    private Duration recurrenceWindow = Duration.ofHours(24);
    private int trendMargin = 5;
    private Duration alertStateRetention = Duration.ofDays(7);
    private Duration sweepInterval = Duration.ofMinutes(1);

    public Duration cooldownFor(SignalSeverity severity) {
        if (severity == null || cooldowns == null || cooldowns.isEmpty()) {
            return null;
        }
        return cooldowns.get(severity);
    }

    public void setCooldowns(Map<SignalSeverity, Duration> cooldowns) {
        if (cooldowns == null) {
            this.cooldowns = new EnumMap<>(SignalSeverity.class);
            return;
        }
        this.cooldowns = new EnumMap<>(cooldowns);
    }

    @PostConstruct
    public void validate() {
        if (cooldowns == null || cooldowns.isEmpty()) {
            throw new IllegalStateException("signal.suppression.cooldowns must be configured for all severities");
        }
        for (SignalSeverity severity : SignalSeverity.values()) {
            Duration duration = cooldowns.get(severity);
            if (duration == null) {
                throw new IllegalStateException(
                        "signal.suppression.cooldowns." + severity + " must be configured"
                );
            }
            if (duration.isZero() || duration.isNegative()) {
                throw new IllegalStateException(
                        "signal.suppression.cooldowns." + severity + " must be > 0"
                );
            }
        }
        requirePositive(dedupWindow, "signal.suppression.dedupWindow");
        requirePositive(recurrenceWindow, "signal.suppression.recurrenceWindow");
        requirePositive(alertStateRetention, "signal.suppression.alertStateRetention");
        requirePositive(sweepInterval, "signal.suppression.sweepInterval");
        if (trendMargin < 0) {
            throw new IllegalStateException("signal.suppression.trendMargin must be >= 0");
        }
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalStateException(name + " must be > 0");
        }
    }

    private static Map<SignalSeverity, Duration> defaultCooldowns() {
        Map<SignalSeverity, Duration> defaults = new EnumMap<>(SignalSeverity.class);
        defaults.put(SignalSeverity.WARNING, Duration.ofMinutes(10));
        defaults.put(SignalSeverity.DANGER, Duration.ofMinutes(15));
        defaults.put(SignalSeverity.CRITICAL, Duration.ofMinutes(30));
        return defaults;
    }
}
