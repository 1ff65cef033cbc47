package com.xbleey.signalalert.service;

import com.xbleey.signalalert.enums.EscalationReason;
import com.xbleey.signalalert.enums.ImpactFilter;
import com.xbleey.signalalert.enums.ImpactLevel;
import com.xbleey.signalalert.model.AlertKey;
import com.xbleey.signalalert.model.AlertState;
import com.xbleey.signalalert.model.DeliveryResult;
import com.xbleey.signalalert.model.NotificationCooldownEntry;
import com.xbleey.signalalert.model.NotificationResult;
import com.xbleey.signalalert.model.SignalAlertHistory;
import com.xbleey.signalalert.model.SignalNotificationRequest;
import com.xbleey.signalalert.model.SignalObservation;
import com.xbleey.signalalert.model.TelegramSubscription;
import com.xbleey.signalalert.repository.SignalAlertHistoryStore;
import com.xbleey.signalalert.repository.SubscriptionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.OptionalLong;

@Service
public class SignalNotificationTrigger {

    private static final Logger log = LoggerFactory.getLogger(SignalNotificationTrigger.class);
    private static final int LOCK_STRIPES = 64;

    private final TelegramNotifier notifier;
    private final SubscriptionStore subscriptionStore;
    private final AlertStateStore alertStateStore;
    private final EscalationDetector escalationDetector;
    private final NotificationCooldownTracker cooldownTracker;
    private final SignalMessageFormatter formatter;
    private final SignalAlertHistoryStore historyStore;
    private final Clock clock;
    private final StripedLock locks = new StripedLock(LOCK_STRIPES);

    public SignalNotificationTrigger(
            TelegramNotifier notifier,
            SubscriptionStore subscriptionStore,
            AlertStateStore alertStateStore,
            EscalationDetector escalationDetector,
            NotificationCooldownTracker cooldownTracker,
            SignalMessageFormatter formatter,
            SignalAlertHistoryStore historyStore,
            Clock clock
    ) {
        this.notifier = notifier;
        this.subscriptionStore = subscriptionStore;
        this.alertStateStore = alertStateStore;
        this.escalationDetector = escalationDetector;
        this.cooldownTracker = cooldownTracker;
        this.formatter = formatter;
        this.historyStore = historyStore == null ? SignalAlertHistoryStore.noop() : historyStore;
        this.clock = clock;
    }

    public NotificationResult trigger(SignalNotificationRequest request) {
        AlertKey alertKey = request.alertKey();
        Object lock = locks.lockFor(alertKey.asString());
        Reservation reservation;
        synchronized (lock) {
            reservation = reserve(request, alertKey);
        }
        if (reservation.rejection() != null) {
            return reservation.rejection();
        }

        SignalObservation observation = request.observation();
        String text = formatter.format(observation, request.tokenName(), request.tokenSymbol(),
                reservation.reason(), reservation.threshold());
        DeliveryResult delivery = null;
        try {
            delivery = notifier.send(reservation.chatId(), text);
        } finally {
            if (delivery == null || !delivery.success()) {
                synchronized (lock) {
                    alertStateStore.release(alertKey, reservation.state(), reservation.previousState());
                    cooldownTracker.release(reservation.cooldownKey(), reservation.cooldown(), reservation.previousCooldown());
                }
            }
        }
        if (!delivery.success()) {
            log.warn("Failed to deliver {} alert for {}: {}", observation.type().code(), alertKey, delivery.error());
            if (isRecipientGone(delivery.error())) {
                disableSubscription(request.walletAddress());
            }
            return NotificationResult.rejected(delivery.error(), reservation.reason());
        }

        alertStateStore.commit(alertKey, reservation.state());
        recordHistory(request, reservation.reason(), delivery, reservation.state().lastAlertAt());
        log.info("Notification sent for {} ({}, {})",
                alertKey, observation.impact().level().code(), reservation.reason().code());
        return NotificationResult.sent(delivery.messageId(), reservation.reason());
    }

    private Reservation reserve(SignalNotificationRequest request, AlertKey alertKey) {
        if (!notifier.isConfigured()) {
            return Reservation.rejected(NotificationResult.rejected("Telegram not configured"));
        }
        Optional<TelegramSubscription> found;
        try {
            found = subscriptionStore.findByWallet(request.walletAddress());
        } catch (Exception ex) {
            log.warn("Failed to load subscription for {}", alertKey.wallet(), ex);
            return Reservation.rejected(NotificationResult.rejected("Subscription unavailable"));
        }
        if (found.isEmpty()) {
            return Reservation.rejected(NotificationResult.rejected("No subscription found"));
        }
        TelegramSubscription subscription = found.get();
        if (!subscription.isEnabled()) {
            return Reservation.rejected(NotificationResult.rejected("Notifications disabled"));
        }
        if (subscription.getChatId() == null) {
            return Reservation.rejected(NotificationResult.rejected("Telegram not connected"));
        }

        SignalObservation observation = request.observation();
        int threshold = subscription.minConfidenceOrDefault();
        AlertState lastState = alertStateStore.find(alertKey).orElse(null);
        Optional<EscalationReason> escalation = escalationDetector.detect(lastState, observation, threshold);
        if (escalation.isEmpty()) {
            log.debug("No escalation for {} since last alert", alertKey);
            return Reservation.rejected(NotificationResult.rejected("No escalation since last alert"));
        }
        EscalationReason reason = escalation.get();

        Optional<String> filtered = applyFilters(subscription, observation);
        if (filtered.isPresent()) {
            return Reservation.rejected(NotificationResult.rejected(filtered.get(), reason));
        }

        ImpactLevel level = observation.impact().level();
        String cooldownKey = NotificationCooldownTracker.key(request.walletAddress(), observation.token(), observation.type());
        OptionalLong remaining = cooldownTracker.remainingSeconds(cooldownKey, level);
        if (remaining.isPresent()) {
            return Reservation.rejected(NotificationResult.coolingDown(remaining.getAsLong(), reason));
        }

        NotificationCooldownEntry previousCooldown = cooldownTracker.find(cooldownKey).orElse(null);
        NotificationCooldownEntry cooldown = cooldownTracker.record(cooldownKey, level);
        AlertState state = new AlertState(
                level,
                observation.confidence(),
                observation.liquidityDropPercent(),
                clock.instant()
        );
        AlertState previousState = alertStateStore.reserve(alertKey, state).orElse(null);
        return new Reservation(null, subscription.getChatId(), reason, threshold,
                cooldownKey, cooldown, previousCooldown, state, previousState);
    }

    private Optional<String> applyFilters(TelegramSubscription subscription, SignalObservation observation) {
        ImpactFilter filter = subscription.impactFilter();
        ImpactLevel level = observation.impact().level();
        if (!filter.accepts(level)) {
            return Optional.of("Impact " + level.code() + " filtered by " + filter.code() + " setting");
        }
        int minConfidence = subscription.minConfidenceOrDefault();
        if (observation.confidencePercent() < minConfidence) {
            return Optional.of("Confidence " + observation.confidencePercent() + "% below " + minConfidence + "% threshold");
        }
        int utcHour = clock.instant().atZone(ZoneOffset.UTC).getHour();
        if (subscription.isQuietHour(utcHour)) {
            return Optional.of("Quiet hours");
        }
        return Optional.empty();
    }

    // 403 "Forbidden: bot was blocked by the user"
    static boolean isRecipientGone(String error) {
        return error != null && error.startsWith("Forbidden");
    }

    private void disableSubscription(String walletAddress) {
        try {
            if (subscriptionStore.updateEnabled(walletAddress, false)) {
                log.warn("Disabled notifications for {}: chat no longer reachable", walletAddress);
            }
        } catch (Exception ex) {
            log.warn("Failed to disable subscription for {}", walletAddress, ex);
        }
    }

    private void recordHistory(SignalNotificationRequest request, EscalationReason reason, DeliveryResult delivery, Instant sentAt) {
        SignalObservation observation = request.observation();
        SignalAlertHistory record = new SignalAlertHistory();
        record.setWalletAddress(request.walletAddress());
        record.setChainId(observation.token().chainId());
        record.setTokenAddress(observation.token().address());
        record.setSignalType(observation.type().code());
        record.setSeverity(observation.severity().code());
        record.setImpactLevel(observation.impact().level().code());
        record.setImpactScore(observation.impact().score());
        record.setConfidence(BigDecimal.valueOf(observation.confidence()));
        if (observation.liquidityDropPercent() != null) {
            record.setLiquidityDropPercent(BigDecimal.valueOf(observation.liquidityDropPercent()));
        }
        record.setEscalationReason(reason.code());
        record.setTelegramMessageId(delivery.messageId());
        record.setDryRun(delivery.dryRun());
        record.setSentAt(sentAt);
        record.setCreatedAt(sentAt);
        try {
            historyStore.save(record);
        } catch (Exception ex) {
            log.warn("Failed to persist alert history for {}", request.alertKey(), ex);
        }
    }

    private record Reservation(
            NotificationResult rejection,
            Long chatId,
            EscalationReason reason,
            int threshold,
            String cooldownKey,
            NotificationCooldownEntry cooldown,
            NotificationCooldownEntry previousCooldown,
            AlertState state,
            AlertState previousState
    ) {

        static Reservation rejected(NotificationResult rejection) {
            return new Reservation(rejection, null, null, 0, null, null, null, null, null);
        }
    }
}
