package com.xbleey.signalalert.service;

import com.xbleey.signalalert.config.TelegramProperties;
import com.xbleey.signalalert.enums.ImpactLevel;
import com.xbleey.signalalert.enums.SignalType;
import com.xbleey.signalalert.model.NotificationCooldownEntry;
import com.xbleey.signalalert.model.TokenRef;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class NotificationCooldownTracker implements SweepableState {

    private final Map<String, NotificationCooldownEntry> entries = new ConcurrentHashMap<>();
    private final TelegramProperties properties;
    private final Clock clock;

    public NotificationCooldownTracker(TelegramProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public static String key(String wallet, TokenRef token, SignalType type) {
        return wallet.toLowerCase(Locale.ROOT) + ":" + token.chainId() + ":" + token.address() + ":" + type.code();
    }

    public OptionalLong remainingSeconds(String key, ImpactLevel level) {
        NotificationCooldownEntry entry = entries.get(key);
        if (entry == null) {
            return OptionalLong.empty();
        }
        Instant now = clock.instant();
        Instant expiresAt = entry.lastSentAt().plus(window());
        if (!now.isBefore(expiresAt)) {
            return OptionalLong.empty();
        }
        if (level != null && level.isHigherThan(entry.lastLevel())) {
            return OptionalLong.empty();
        }
        long remainingMillis = Duration.between(now, expiresAt).toMillis();
        return OptionalLong.of((remainingMillis + 999) / 1000);
    }

    public NotificationCooldownEntry record(String key, ImpactLevel level) {
        NotificationCooldownEntry entry = new NotificationCooldownEntry(clock.instant(), level);
        entries.put(key, entry);
        return entry;
    }

    void release(String key, NotificationCooldownEntry reserved, NotificationCooldownEntry previous) {
        if (previous == null) {
            entries.remove(key, reserved);
        } else {
            entries.replace(key, reserved, previous);
        }
    }

    public Optional<NotificationCooldownEntry> find(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public String stateName() {
        return "notificationCooldown";
    }

    @Override
    public int sweep(Instant now) {
        Instant cutoff = now.minus(window().multipliedBy(2));
        int removed = 0;
        for (Map.Entry<String, NotificationCooldownEntry> entry : entries.entrySet()) {
            if (entry.getValue().lastSentAt().isBefore(cutoff) && entries.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return entries.size();
    }

    private Duration window() {
        return properties.getNotificationCooldown();
    }
}
