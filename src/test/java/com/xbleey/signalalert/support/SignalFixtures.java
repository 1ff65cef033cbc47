package com.xbleey.signalalert.support;

import com.xbleey.signalalert.config.SignalSuppressionProperties;
import com.xbleey.signalalert.config.TelegramProperties;
import com.xbleey.signalalert.enums.CooldownDecision;
import com.xbleey.signalalert.enums.RiskFactor;
import com.xbleey.signalalert.enums.SignalSeverity;
import com.xbleey.signalalert.model.CooldownAdmission;
import com.xbleey.signalalert.model.CooldownEntry;
import com.xbleey.signalalert.model.LiquidityFacts;
import com.xbleey.signalalert.model.RiskFacts;
import com.xbleey.signalalert.model.SignalObservation;
import com.xbleey.signalalert.model.TokenRef;
import com.xbleey.signalalert.service.ImpactScorer;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public final class SignalFixtures {

    public static final String TOKEN = "0x1111111111111111111111111111111111111111";
    public static final String WALLET = "0xAbCdEf0000000000000000000000000000000001";
    public static final long CHAT_ID = 424242L;

    private SignalFixtures() {
    }

    public static TokenRef token() {
        return TokenRef.of(1, TOKEN);
    }

    public static SignalSuppressionProperties suppressionProperties() {
        return new SignalSuppressionProperties();
    }

    public static TelegramProperties dryRunTelegram() {
        TelegramProperties properties = new TelegramProperties();
        properties.setDryRun(true);
        return properties;
    }

    public static RiskFacts honeypotFacts() {
        return new RiskFacts(List.of(RiskFactor.MINTABLE, RiskFactor.EXTERNAL_CALL), true);
    }

    public static LiquidityFacts liquidityDrop(double dropPercent) {
        return new LiquidityFacts(50_000.0, -dropPercent, 50_000.0);
    }

    public static SignalObservation riskObservation(RiskFacts facts) {
        return new ImpactScorer().scoreRisk(token(), facts).orElseThrow();
    }

    public static SignalObservation liquidityObservation(double dropPercent) {
        return new ImpactScorer().scoreLiquidity(token(), liquidityDrop(dropPercent)).orElseThrow();
    }

    public static CooldownAdmission startedAdmission(SignalSeverity severity, Instant now) {
        CooldownEntry entry = new CooldownEntry(now, now.plus(Duration.ofMinutes(30)), severity);
        return new CooldownAdmission(CooldownDecision.STARTED, null, entry);
    }
}
