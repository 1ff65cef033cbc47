package com.xbleey.signalalert.model;

public record LiquidityFacts(Double liquidityUsd, double changePercent, double volume24hUsd) {

    public static LiquidityFacts noPool() {
        return new LiquidityFacts(null, 0, 0);
    }

    public boolean hasPool() {
        return liquidityUsd != null && liquidityUsd > 0;
    }

    public double dropPercent() {
        return changePercent < 0 ? -changePercent : 0;
    }

    public boolean hasVolume() {
        return volume24hUsd > 0;
    }
}
