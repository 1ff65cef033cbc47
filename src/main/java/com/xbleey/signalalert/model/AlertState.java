package com.xbleey.signalalert.model;

import com.xbleey.signalalert.enums.ImpactLevel;

import java.time.Instant;

public record AlertState(ImpactLevel lastImpact, double lastConfidence, Double lastLiquidityDrop, Instant lastAlertAt) {
}
