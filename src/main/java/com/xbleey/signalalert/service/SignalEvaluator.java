package com.xbleey.signalalert.service;

import com.xbleey.signalalert.config.SignalProperties;
import com.xbleey.signalalert.enums.FetchStatus;
import com.xbleey.signalalert.enums.SignalType;
import com.xbleey.signalalert.model.CooldownAdmission;
import com.xbleey.signalalert.model.FetchResult;
import com.xbleey.signalalert.model.LiquidityFacts;
import com.xbleey.signalalert.model.NotificationResult;
import com.xbleey.signalalert.model.RecurrenceInfo;
import com.xbleey.signalalert.model.RiskFacts;
import com.xbleey.signalalert.model.SignalEvaluation;
import com.xbleey.signalalert.model.SignalKey;
import com.xbleey.signalalert.model.SignalNotificationRequest;
import com.xbleey.signalalert.model.SignalObservation;
import com.xbleey.signalalert.model.SignalSnapshot;
import com.xbleey.signalalert.model.TokenRef;
import com.xbleey.signalalert.model.WalletEvaluation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Service
public class SignalEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SignalEvaluator.class);
    private static final int LOCK_STRIPES = 64;

    private final RiskAdapter riskAdapter;
    private final LiquidityAdapter liquidityAdapter;
    private final SignalResultCache cache;
    private final ImpactScorer scorer;
    private final SignalDedupGuard dedupGuard;
    private final SignalCooldownTracker cooldownTracker;
    private final SignalRecurrenceTracker recurrenceTracker;
    private final SignalNotificationTrigger notificationTrigger;
    private final SignalProperties properties;
    private final Clock clock;
    private final StripedLock locks = new StripedLock(LOCK_STRIPES);

    public SignalEvaluator(
            RiskAdapter riskAdapter,
            LiquidityAdapter liquidityAdapter,
            SignalResultCache cache,
            ImpactScorer scorer,
            SignalDedupGuard dedupGuard,
            SignalCooldownTracker cooldownTracker,
            SignalRecurrenceTracker recurrenceTracker,
            SignalNotificationTrigger notificationTrigger,
            SignalProperties properties,
            Clock clock
    ) {
        this.riskAdapter = riskAdapter;
        this.liquidityAdapter = liquidityAdapter;
        this.cache = cache;
        this.scorer = scorer;
        this.dedupGuard = dedupGuard;
        this.cooldownTracker = cooldownTracker;
        this.recurrenceTracker = recurrenceTracker;
        this.notificationTrigger = notificationTrigger;
        this.properties = properties;
        this.clock = clock;
    }

    public SignalSnapshot evaluate(TokenRef token) {
        Instant now = clock.instant();
        if (!properties.isEnabled()) {
            return SignalSnapshot.disabled(token, now);
        }
        SignalEvaluation risk = evaluateRisk(token);
        SignalEvaluation liquidity = evaluateLiquidity(token);
        return new SignalSnapshot(token, true, now, risk, liquidity);
    }

    public WalletEvaluation evaluateForWallet(String walletAddress, TokenRef token, String tokenName, String tokenSymbol) {
        String wallet = TokenRef.normalizeAddress(walletAddress, "wallet");
        SignalSnapshot snapshot = evaluate(token);
        Map<SignalType, NotificationResult> notifications = new EnumMap<>(SignalType.class);
        if (snapshot.enabled()) {
            notifyIfEmitted(wallet, snapshot.risk(), tokenName, tokenSymbol, notifications);
            notifyIfEmitted(wallet, snapshot.liquidity(), tokenName, tokenSymbol, notifications);
        }
        return new WalletEvaluation(wallet, snapshot, notifications);
    }

    SignalEvaluation evaluateRisk(TokenRef token) {
        FetchResult<RiskFacts> facts = load(SignalType.RISK, token, RiskFacts.class,
                properties.getRiskCacheTtl(), riskAdapter::fetchRiskFacts);
        if (!facts.hasData()) {
            return SignalEvaluation.noSignal(SignalType.RISK, facts.status(), facts.reason());
        }
        Optional<SignalObservation> observation = scorer.scoreRisk(token, facts.data());
        if (observation.isEmpty()) {
            return SignalEvaluation.noSignal(SignalType.RISK, facts.status(), withFetchReason("No risk factors detected", facts));
        }
        return suppressOrEmit(observation.get(), facts);
    }

    SignalEvaluation evaluateLiquidity(TokenRef token) {
        FetchResult<LiquidityFacts> facts = load(SignalType.LIQUIDITY, token, LiquidityFacts.class,
                properties.getLiquidityCacheTtl(), liquidityAdapter::fetchLiquidityFacts);
        if (!facts.hasData()) {
            return SignalEvaluation.noSignal(SignalType.LIQUIDITY, facts.status(), facts.reason());
        }
        Optional<SignalObservation> observation = scorer.scoreLiquidity(token, facts.data());
        if (observation.isEmpty()) {
            String reason = facts.data().hasPool()
                    ? "Liquidity change above -" + (int) ImpactScorer.LIQUIDITY_SIGNAL_THRESHOLD + "%"
                    : "No liquidity pool found";
            return SignalEvaluation.noSignal(SignalType.LIQUIDITY, facts.status(), withFetchReason(reason, facts));
        }
        return suppressOrEmit(observation.get(), facts);
    }

    private SignalEvaluation suppressOrEmit(SignalObservation observation, FetchResult<?> facts) {
        SignalKey key = observation.key();
        synchronized (locks.lockFor(key.asString())) {
            if (dedupGuard.isDuplicate(observation)) {
                log.debug("Suppressed duplicate {} signal for {}", key.type().code(), key);
                return SignalEvaluation.duplicate(observation, facts.status());
            }
            CooldownAdmission admission = cooldownTracker.admit(key, observation.severity());
            if (admission.suppressed()) {
                long remaining = admission.entry().remainingSeconds(clock.instant());
                log.debug("Suppressed {} signal in cooldown ({}s remaining)", key, remaining);
                return SignalEvaluation.coolingDown(observation, facts.status(), admission, remaining);
            }
            RecurrenceInfo recurrence = recurrenceTracker.observe(key, observation.severity(), observation.impact().score());
            log.info("Emitting {} signal for {}: severity={} impact={} confidence={}",
                    key.type().code(), key, observation.severity().code(),
                    observation.impact().score(), observation.confidence());
            return SignalEvaluation.emitted(observation, facts.status(), admission, recurrence, facts.reason());
        }
    }

    private void notifyIfEmitted(
            String wallet,
            SignalEvaluation evaluation,
            String tokenName,
            String tokenSymbol,
            Map<SignalType, NotificationResult> notifications
    ) {
        if (evaluation == null || !evaluation.emitted()) {
            return;
        }
        NotificationResult result = notificationTrigger.trigger(
                new SignalNotificationRequest(wallet, evaluation.observation(), tokenName, tokenSymbol)
        );
        notifications.put(evaluation.type(), result);
    }

    private <T> FetchResult<T> load(
            SignalType type,
            TokenRef token,
            Class<T> dataType,
            Duration ttl,
            Function<TokenRef, FetchResult<T>> upstream
    ) {
        String cacheKey = SignalResultCache.cacheKey(type, token);
        FetchResult<T> cached = cache.get(cacheKey, dataType);
        if (cached.hasData()) {
            return cached;
        }
        FetchResult<T> fetched = upstream.apply(token);
        if (!fetched.hasData()) {
            return fetched;
        }
        boolean shared = cache.set(cacheKey, fetched.data(), ttl);
        if (cached.status() == FetchStatus.DEGRADED || !shared) {
            return fetched.degrade(SignalResultCache.DEGRADED_REASON);
        }
        return fetched;
    }

    private static String withFetchReason(String reason, FetchResult<?> facts) {
        if (facts.reason() == null) {
            return reason;
        }
        return reason + " (" + facts.reason() + ")";
    }
}
