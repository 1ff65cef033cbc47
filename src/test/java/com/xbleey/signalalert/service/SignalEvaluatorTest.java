package com.xbleey.signalalert.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.signalalert.config.SignalProperties;
import com.xbleey.signalalert.config.SignalSuppressionProperties;
import com.xbleey.signalalert.config.TelegramProperties;
import com.xbleey.signalalert.enums.EscalationReason;
import com.xbleey.signalalert.enums.FetchStatus;
import com.xbleey.signalalert.enums.RecurrenceTrend;
import com.xbleey.signalalert.enums.SignalSeverity;
import com.xbleey.signalalert.enums.SignalType;
import com.xbleey.signalalert.enums.SuppressionReason;
import com.xbleey.signalalert.model.FetchResult;
import com.xbleey.signalalert.model.LiquidityFacts;
import com.xbleey.signalalert.model.NotificationResult;
import com.xbleey.signalalert.model.RiskFacts;
import com.xbleey.signalalert.model.SignalAlertHistory;
import com.xbleey.signalalert.model.SignalEvaluation;
import com.xbleey.signalalert.model.SignalSnapshot;
import com.xbleey.signalalert.model.TelegramSubscription;
import com.xbleey.signalalert.model.WalletEvaluation;
import com.xbleey.signalalert.support.InMemorySubscriptionStore;
import com.xbleey.signalalert.support.MutableClock;
import com.xbleey.signalalert.support.SignalFixtures;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SignalEvaluatorTest {

    private final MutableClock clock = MutableClock.at("2026-03-02T10:00:00Z");
    private final AtomicReference<FetchResult<RiskFacts>> riskFacts = new AtomicReference<>(FetchResult.ok(RiskFacts.none()));
    private final AtomicReference<FetchResult<LiquidityFacts>> liquidityFacts =
            new AtomicReference<>(FetchResult.ok(LiquidityFacts.noPool()));
    private final AtomicInteger upstreamCalls = new AtomicInteger();
    private final InMemorySubscriptionStore subscriptionStore = new InMemorySubscriptionStore();
    private final List<SignalAlertHistory> history = new ArrayList<>();
    private ValueOperations<String, String> valueOperations;
    private SignalProperties properties;
    private SignalEvaluator evaluator;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        ObjectMapper objectMapper = new ObjectMapper();
        SignalSuppressionProperties suppression = SignalFixtures.suppressionProperties();
        TelegramProperties telegram = SignalFixtures.dryRunTelegram();

        properties = new SignalProperties();
        properties.setGoplusApiUrl(URI.create("http://localhost/goplus"));
        properties.setDexscreenerApiUrl(URI.create("http://localhost/dexscreener"));

        SignalNotificationTrigger trigger = new SignalNotificationTrigger(
                new TelegramNotifier(new OkHttpClient(), objectMapper, telegram),
                subscriptionStore,
                new AlertStateStore(suppression),
                new EscalationDetector(),
                new NotificationCooldownTracker(telegram, clock),
                new SignalMessageFormatter(telegram),
                record -> {
                    history.add(record);
                    return record;
                },
                clock
        );
        evaluator = new SignalEvaluator(
                token -> {
                    upstreamCalls.incrementAndGet();
                    return riskFacts.get();
                },
                token -> {
                    upstreamCalls.incrementAndGet();
                    return liquidityFacts.get();
                },
                new SignalResultCache(redisTemplate, objectMapper, clock),
                new ImpactScorer(),
                new SignalDedupGuard(objectMapper, suppression, clock),
                new SignalCooldownTracker(suppression, clock),
                new SignalRecurrenceTracker(suppression, clock),
                trigger,
                properties,
                clock
        );
    }

    @Test
    void disabledEvaluationSkipsUpstream() {
        properties.setEnabled(false);

        SignalSnapshot snapshot = evaluator.evaluate(SignalFixtures.token());

        assertThat(snapshot.enabled()).isFalse();
        assertThat(snapshot.risk()).isNull();
        assertThat(upstreamCalls.get()).isZero();
    }

    @Test
    void cleanTokenHasNoSignals() {
        SignalSnapshot snapshot = evaluator.evaluate(SignalFixtures.token());

        assertThat(snapshot.risk().hasSignal()).isFalse();
        assertThat(snapshot.risk().debugReason()).isEqualTo("No risk factors detected");
        assertThat(snapshot.liquidity().hasSignal()).isFalse();
        assertThat(snapshot.liquidity().debugReason()).isEqualTo("No liquidity pool found");
    }

    @Test
    void upstreamFailureEndsAsNoSignal() {
        riskFacts.set(FetchResult.unavailable("Risk provider returned http 503"));

        SignalEvaluation risk = evaluator.evaluateRisk(SignalFixtures.token());

        assertThat(risk.hasSignal()).isFalse();
        assertThat(risk.emitted()).isFalse();
        assertThat(risk.fetchStatus()).isEqualTo(FetchStatus.UNAVAILABLE);
        assertThat(risk.debugReason()).isEqualTo("Risk provider returned http 503");
    }

    @Test
    void cachedFactsSkipUpstream() throws Exception {
        when(valueOperations.get(anyString()))
                .thenReturn(new ObjectMapper().writeValueAsString(SignalFixtures.honeypotFacts()));

        SignalEvaluation risk = evaluator.evaluateRisk(SignalFixtures.token());

        assertThat(risk.emitted()).isTrue();
        assertThat(upstreamCalls.get()).isZero();
    }

    @Test
    void unreachableRedisDegradesButStillEmits() {
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));
        riskFacts.set(FetchResult.ok(SignalFixtures.honeypotFacts()));

        SignalEvaluation risk = evaluator.evaluateRisk(SignalFixtures.token());

        assertThat(risk.emitted()).isTrue();
        assertThat(risk.fetchStatus()).isEqualTo(FetchStatus.DEGRADED);
    }

    @Test
    void changedStateAtSameSeverityWaitsForCooldown() {
        liquidityFacts.set(FetchResult.ok(SignalFixtures.liquidityDrop(35)));
        evaluator.evaluateLiquidity(SignalFixtures.token());
        clock.advance(Duration.ofMinutes(1));
        liquidityFacts.set(FetchResult.ok(SignalFixtures.liquidityDrop(38)));

        SignalEvaluation second = evaluator.evaluateLiquidity(SignalFixtures.token());

        assertThat(second.emitted()).isFalse();
        assertThat(second.suppression()).isEqualTo(SuppressionReason.COOLDOWN);
        assertThat(second.cooldownRemainingSeconds()).isEqualTo(540L);
    }

    @Test
    void higherSeverityBreaksThroughCooldown() {
        liquidityFacts.set(FetchResult.ok(SignalFixtures.liquidityDrop(35)));
        evaluator.evaluateLiquidity(SignalFixtures.token());
        clock.advance(Duration.ofMinutes(2));
        liquidityFacts.set(FetchResult.ok(SignalFixtures.liquidityDrop(50)));

        SignalEvaluation second = evaluator.evaluateLiquidity(SignalFixtures.token());

        assertThat(second.emitted()).isTrue();
        assertThat(second.escalated()).isTrue();
        assertThat(second.previousSeverity()).isEqualTo(SignalSeverity.WARNING);
        assertThat(second.recurrence().occurrences24h()).isEqualTo(2);
        assertThat(second.recurrence().trend()).isEqualTo(RecurrenceTrend.INCREASING);
    }

    @Test
    void honeypotAlertIsDeduplicatedThirtySecondsLater() {
        subscribe();
        riskFacts.set(FetchResult.ok(SignalFixtures.honeypotFacts()));

        WalletEvaluation first = evaluator.evaluateForWallet(SignalFixtures.WALLET, SignalFixtures.token(), "Scam", "SCM");
        clock.advance(Duration.ofSeconds(30));
        WalletEvaluation second = evaluator.evaluateForWallet(SignalFixtures.WALLET, SignalFixtures.token(), "Scam", "SCM");

        SignalEvaluation firstRisk = first.snapshot().risk();
        assertThat(firstRisk.emitted()).isTrue();
        assertThat(firstRisk.observation().severity()).isEqualTo(SignalSeverity.CRITICAL);
        assertThat(firstRisk.observation().confidence()).isEqualTo(0.95);
        assertThat(firstRisk.observation().impact().score()).isGreaterThanOrEqualTo(84);
        NotificationResult notification = first.notifications().get(SignalType.RISK);
        assertThat(notification.sent()).isTrue();
        assertThat(notification.escalationReason()).isEqualTo(EscalationReason.FIRST_ALERT);

        assertThat(second.snapshot().risk().emitted()).isFalse();
        assertThat(second.snapshot().risk().suppression()).isEqualTo(SuppressionReason.DUPLICATE);
        assertThat(second.notifications()).doesNotContainKey(SignalType.RISK);
        assertThat(history).hasSize(1);
    }

    @Test
    void liquidityEscalationReachesWalletTwoMinutesLater() {
        subscribe();
        liquidityFacts.set(FetchResult.ok(SignalFixtures.liquidityDrop(35)));

        WalletEvaluation first = evaluator.evaluateForWallet(SignalFixtures.WALLET, SignalFixtures.token(), null, null);
        clock.advance(Duration.ofMinutes(2));
        liquidityFacts.set(FetchResult.ok(SignalFixtures.liquidityDrop(50)));
        WalletEvaluation second = evaluator.evaluateForWallet(SignalFixtures.WALLET, SignalFixtures.token(), null, null);

        NotificationResult firstNotification = first.notifications().get(SignalType.LIQUIDITY);
        assertThat(firstNotification.sent()).isTrue();
        assertThat(firstNotification.escalationReason()).isEqualTo(EscalationReason.FIRST_ALERT);

        SignalEvaluation liquidity = second.snapshot().liquidity();
        assertThat(liquidity.emitted()).isTrue();
        assertThat(liquidity.escalated()).isTrue();
        NotificationResult secondNotification = second.notifications().get(SignalType.LIQUIDITY);
        assertThat(secondNotification.sent()).isTrue();
        assertThat(secondNotification.escalationReason()).isEqualTo(EscalationReason.IMPACT_ESCALATED);
        assertThat(history).extracting(SignalAlertHistory::getImpactLevel).containsExactly("medium", "high");
    }

    private void subscribe() {
        TelegramSubscription subscription = InMemorySubscriptionStore.subscription(SignalFixtures.WALLET, SignalFixtures.CHAT_ID);
        subscription.setMinImpact("high+medium");
        subscription.setMinConfidence(70);
        subscriptionStore.save(subscription);
    }
}
