package com.xbleey.signalalert.exception;

public class SubscriptionNotFoundException extends RuntimeException {

    public SubscriptionNotFoundException(String walletAddress) {
        super("No subscription found for wallet " + walletAddress);
    }
}
