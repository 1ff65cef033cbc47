package com.xbleey.signalalert.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "signal.telegram")
public class TelegramProperties {

    private String botToken;
    private URI apiBaseUrl = URI.create("https://api.telegram.org");
    private boolean dryRun;
    private int maxAttempts = 3;
    private List<Duration> retryDelays = new ArrayList<>(List.of(
            Duration.ofSeconds(1),
            Duration.ofSeconds(2),
            Duration.ofSeconds(4)
    ));
    private Duration maxRetryAfter = Duration.ofSeconds(30);
    private Duration notificationCooldown = Duration.ofMinutes(5);
    private String radarUrl;

    public boolean hasBotToken() {
        return botToken != null && !botToken.isBlank();
    }

    /**
     * Dry-run counts as configured so the whole notification path can run without a bot.
     */
    public boolean isConfigured() {
        return dryRun || hasBotToken();
    }

    public Duration retryDelay(int attempt) {
        if (retryDelays == null || retryDelays.isEmpty()) {
            return Duration.ZERO;
        }
        int index = Math.min(Math.max(attempt, 0), retryDelays.size() - 1);
        return retryDelays.get(index);
    }

    @PostConstruct
    public void validate() {
        if (apiBaseUrl == null) {
            throw new IllegalStateException("signal.telegram.apiBaseUrl must be configured");
        }
        if (maxAttempts < 1) {
            throw new IllegalStateException("signal.telegram.maxAttempts must be >= 1");
        }
        if (retryDelays != null) {
            for (Duration delay : retryDelays) {
                if (delay == null || delay.isNegative()) {
                    throw new IllegalStateException("signal.telegram.retryDelays must be >= 0");
                }
            }
        }
        if (maxRetryAfter == null || maxRetryAfter.isNegative()) {
            throw new IllegalStateException("signal.telegram.maxRetryAfter must be >= 0");
        }
        if (notificationCooldown == null || notificationCooldown.isNegative()) {
            throw new IllegalStateException("signal.telegram.notificationCooldown must be >= 0");
        }
    }
}
