package com.xbleey.signalalert.service;

import com.xbleey.signalalert.enums.ImpactLevel;
import com.xbleey.signalalert.enums.RiskFactor;
import com.xbleey.signalalert.enums.SignalSeverity;
import com.xbleey.signalalert.enums.SignalType;
import com.xbleey.signalalert.model.ImpactScore;
import com.xbleey.signalalert.model.LiquidityFacts;
import com.xbleey.signalalert.model.RiskFacts;
import com.xbleey.signalalert.model.SignalObservation;
import com.xbleey.signalalert.model.TokenRef;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Component
public class ImpactScorer {

    public static final double LIQUIDITY_SIGNAL_THRESHOLD = 30.0;
    private static final double MAX_CONFIDENCE = 0.95;
    private static final int REASON_FACTOR_LIMIT = 3;

    public Optional<SignalObservation> scoreRisk(TokenRef token, RiskFacts facts) {
        if (facts == null || !facts.hasFactors()) {
            return Optional.empty();
        }
        double confidence = riskConfidence(facts);
        SignalSeverity severity = riskSeverity(facts);
        ImpactScore impact = riskImpact(facts, severity, confidence);
        return Optional.of(new SignalObservation(
                token,
                SignalType.RISK,
                severity,
                confidence,
                impact,
                facts.factors(),
                facts.honeypot(),
                null,
                null
        ));
    }

    public Optional<SignalObservation> scoreLiquidity(TokenRef token, LiquidityFacts facts) {
        if (facts == null || !facts.hasPool()) {
            return Optional.empty();
        }
        double dropPercent = facts.dropPercent();
        if (dropPercent < LIQUIDITY_SIGNAL_THRESHOLD) {
            return Optional.empty();
        }
        double confidence = liquidityConfidence(dropPercent, facts.hasVolume());
        SignalSeverity severity = liquiditySeverity(dropPercent);
        ImpactScore impact = liquidityImpact(dropPercent, facts.liquidityUsd(), severity, confidence);
        return Optional.of(new SignalObservation(
                token,
                SignalType.LIQUIDITY,
                severity,
                confidence,
                impact,
                List.of(),
                false,
                round2(dropPercent),
                facts.liquidityUsd()
        ));
    }

    public static double riskConfidence(RiskFacts facts) {
        int count = facts.factors().size();
        double confidence = 0.5;
        if (facts.honeypot()) {
            confidence += 0.4;
        }
        if (count >= 5) {
            confidence += 0.25;
        } else if (count >= 3) {
            confidence += 0.20;
        } else if (count >= 1) {
            confidence += 0.10;
        }
        if (facts.hasOwnershipControl()) {
            confidence += 0.10;
        }
        return Math.min(MAX_CONFIDENCE, round2(confidence));
    }

    public static SignalSeverity riskSeverity(RiskFacts facts) {
        int count = facts.factors().size();
        if (facts.honeypot() || count >= 5) {
            return SignalSeverity.CRITICAL;
        }
        if (count >= 3) {
            return SignalSeverity.DANGER;
        }
        return SignalSeverity.WARNING;
    }

    public static double liquidityConfidence(double dropPercent, boolean hasVolume) {
        double confidence = 0.5;
        if (dropPercent >= 50) {
            confidence += 0.20;
        } else if (dropPercent >= 40) {
            confidence += 0.15;
        } else if (dropPercent >= 30) {
            confidence += 0.10;
        }
        if (hasVolume) {
            confidence += 0.15;
        }
        return Math.min(MAX_CONFIDENCE, round2(confidence));
    }

    public static SignalSeverity liquiditySeverity(double dropPercent) {
        if (dropPercent >= 65) {
            return SignalSeverity.CRITICAL;
        }
        if (dropPercent >= 45) {
            return SignalSeverity.DANGER;
        }
        return SignalSeverity.WARNING;
    }

    static ImpactScore riskImpact(RiskFacts facts, SignalSeverity severity, double confidence) {
        int count = facts.factors().size();
        int score = 0;
        if (facts.honeypot()) {
            score += 50;
        }
        if (count >= 5) {
            score += 30;
        } else if (count >= 3) {
            score += 20;
        } else if (count >= 1) {
            score += 10;
        }
        if (!facts.honeypot()) {
            score += switch (severity) {
                case CRITICAL -> 20;
                case DANGER -> 15;
                case WARNING -> 5;
            };
            if (facts.hasCriticalFactor()) {
                score += 10;
            }
        }
        score += (int) Math.round(confidence * 15);
        score = clamp(score);
        return new ImpactScore(score, ImpactLevel.fromScore(score), riskReason(facts));
    }

    static ImpactScore liquidityImpact(double dropPercent, Double liquidityUsd, SignalSeverity severity, double confidence) {
        int score;
        if (dropPercent >= 70) {
            score = 40;
        } else if (dropPercent >= 50) {
            score = 30;
        } else if (dropPercent >= 35) {
            score = 20;
        } else {
            score = 10;
        }
        score += switch (severity) {
            case CRITICAL -> 30;
            case DANGER -> 20;
            case WARNING -> 10;
        };
        score += (int) Math.round(confidence * 20);
        if (liquidityUsd != null) {
            if (liquidityUsd >= 1_000_000) {
                score += 10;
            } else if (liquidityUsd >= 100_000) {
                score += 7;
            } else if (liquidityUsd >= 10_000) {
                score += 4;
            } else {
                score += 2;
            }
        }
        score = clamp(score);
        return new ImpactScore(score, ImpactLevel.fromScore(score), liquidityReason(dropPercent, liquidityUsd));
    }

    private static String riskReason(RiskFacts facts) {
        if (facts.honeypot()) {
            return "Honeypot detected - cannot sell";
        }
        List<RiskFactor> factors = facts.factors();
        String labels = factors.stream()
                .limit(REASON_FACTOR_LIMIT)
                .map(RiskFactor::getLabel)
                .collect(Collectors.joining(", "));
        if (factors.size() > REASON_FACTOR_LIMIT) {
            labels = labels + " +" + (factors.size() - REASON_FACTOR_LIMIT) + " more";
        }
        return factors.size() + (factors.size() == 1 ? " risk factor: " : " risk factors: ") + labels;
    }

    private static String liquidityReason(double dropPercent, Double liquidityUsd) {
        String magnitude;
        if (dropPercent >= 70) {
            magnitude = "massive drop";
        } else if (dropPercent >= 50) {
            magnitude = "severe drop";
        } else if (dropPercent >= 35) {
            magnitude = "significant drop";
        } else {
            magnitude = "moderate drop";
        }
        String reason = Math.round(dropPercent) + "% drop, " + magnitude;
        if (liquidityUsd != null && liquidityUsd >= 1_000_000) {
            reason = reason + ", high liquidity";
        }
        return reason;
    }

    private static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
