package com.xbleey.signalalert.service;

import com.xbleey.signalalert.enums.ImpactFilter;
import com.xbleey.signalalert.exception.InvalidSignalRequestException;
import com.xbleey.signalalert.exception.SubscriptionNotFoundException;
import com.xbleey.signalalert.model.TelegramSettingsRequest;
import com.xbleey.signalalert.model.TelegramSubscription;
import com.xbleey.signalalert.model.TokenRef;
import com.xbleey.signalalert.repository.SubscriptionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

@Service
public class SubscriptionSettingsService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionSettingsService.class);

    private final SubscriptionStore subscriptionStore;
    private final Clock clock;

    public SubscriptionSettingsService(SubscriptionStore subscriptionStore, Clock clock) {
        this.subscriptionStore = subscriptionStore;
        this.clock = clock;
    }

    public Optional<TelegramSubscription> find(String walletAddress) {
        return subscriptionStore.findByWallet(TokenRef.normalizeAddress(walletAddress, "wallet"));
    }

    public TelegramSubscription update(TelegramSettingsRequest request) {
        if (request == null) {
            throw new InvalidSignalRequestException("Missing settings body");
        }
        String wallet = TokenRef.normalizeAddress(request.wallet(), "wallet");
        TelegramSubscription subscription = subscriptionStore.findByWallet(wallet)
                .orElseThrow(() -> new SubscriptionNotFoundException(wallet));

        if (request.minImpact() != null && !request.minImpact().isBlank()) {
            subscription.setMinImpact(parseImpactFilter(request.minImpact()).code());
        }
        if (request.minConfidence() != null) {
            if (request.minConfidence() < 0 || request.minConfidence() > 100) {
                throw new InvalidSignalRequestException("minConfidence must be between 0 and 100");
            }
            subscription.setMinConfidence(request.minConfidence());
        }
        if (Boolean.TRUE.equals(request.clearQuietHours())) {
            subscription.setQuietHoursStart(null);
            subscription.setQuietHoursEnd(null);
        } else if (request.quietHoursStart() != null || request.quietHoursEnd() != null) {
            if (request.quietHoursStart() == null || request.quietHoursEnd() == null) {
                throw new InvalidSignalRequestException("quietHoursStart and quietHoursEnd must be set together");
            }
            subscription.setQuietHoursStart(validHour(request.quietHoursStart(), "quietHoursStart"));
            subscription.setQuietHoursEnd(validHour(request.quietHoursEnd(), "quietHoursEnd"));
        }
        if (request.enabled() != null) {
            subscription.setEnabled(request.enabled());
        }
        subscription.setUpdatedAt(clock.instant());
        subscriptionStore.update(subscription);
        log.info("Updated telegram settings for {}: enabled={} minImpact={} minConfidence={}",
                wallet, subscription.isEnabled(), subscription.getMinImpact(), subscription.getMinConfidence());
        return subscription;
    }

    private static ImpactFilter parseImpactFilter(String code) {
        try {
            return ImpactFilter.fromCode(code);
        } catch (IllegalArgumentException ex) {
            throw new InvalidSignalRequestException("minImpact must be one of high, high+medium, all");
        }
    }

    private static int validHour(int hour, String field) {
        if (hour < 0 || hour > 23) {
            throw new InvalidSignalRequestException(field + " must be between 0 and 23");
        }
        return hour;
    }
}
