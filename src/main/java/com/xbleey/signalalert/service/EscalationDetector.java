package com.xbleey.signalalert.service;

import com.xbleey.signalalert.enums.EscalationReason;
import com.xbleey.signalalert.enums.ImpactLevel;
import com.xbleey.signalalert.enums.SignalType;
import com.xbleey.signalalert.model.AlertState;
import com.xbleey.signalalert.model.SignalObservation;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class EscalationDetector {

    static final double CONFIDENCE_STEP = 0.15;
    static final double LIQUIDITY_STEP_PERCENT = 10.0;
    // 浮点误差容忍，避免 0.80 - 0.65 被判定为小于 0.15
    private static final double EPSILON = 1e-9;

    public Optional<EscalationReason> detect(AlertState last, SignalObservation observation, int confidenceThresholdPercent) {
        if (last == null) {
            return Optional.of(EscalationReason.FIRST_ALERT);
        }
        ImpactLevel currentLevel = observation.impact().level();
        if (last.lastImpact() == ImpactLevel.MEDIUM && currentLevel == ImpactLevel.HIGH) {
            return Optional.of(EscalationReason.IMPACT_ESCALATED);
        }
        double threshold = confidenceThresholdPercent / 100.0;
        double increase = observation.confidence() - last.lastConfidence();
        boolean crossed = last.lastConfidence() < threshold && observation.confidence() >= threshold;
        if (increase + EPSILON >= CONFIDENCE_STEP && crossed) {
            return Optional.of(EscalationReason.CONFIDENCE_THRESHOLD_CROSSED);
        }
        if (observation.type() == SignalType.LIQUIDITY
                && observation.liquidityDropPercent() != null
                && last.lastLiquidityDrop() != null
                && observation.liquidityDropPercent() - last.lastLiquidityDrop() + EPSILON >= LIQUIDITY_STEP_PERCENT) {
            return Optional.of(EscalationReason.LIQUIDITY_WORSENED);
        }
        return Optional.empty();
    }
}
