package com.xbleey.signalalert.model;

import java.time.Instant;

public record SignalSnapshot(
        TokenRef token,
        boolean enabled,
        Instant evaluatedAt,
        SignalEvaluation risk,
        SignalEvaluation liquidity
) {

    public static SignalSnapshot disabled(TokenRef token, Instant evaluatedAt) {
        return new SignalSnapshot(token, false, evaluatedAt, null, null);
    }
}
