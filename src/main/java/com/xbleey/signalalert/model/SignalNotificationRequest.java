package com.xbleey.signalalert.model;

public record SignalNotificationRequest(
        String walletAddress,
        SignalObservation observation,
        String tokenName,
        String tokenSymbol
) {

    public SignalNotificationRequest {
        walletAddress = TokenRef.normalizeAddress(walletAddress, "wallet");
        if (observation == null) {
            throw new IllegalArgumentException("observation must not be null");
        }
    }

    public AlertKey alertKey() {
        return new AlertKey(walletAddress, observation.token().address(), observation.type());
    }
}
