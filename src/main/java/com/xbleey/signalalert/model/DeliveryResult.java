package com.xbleey.signalalert.model;

public record DeliveryResult(boolean success, Long messageId, String error, boolean dryRun) {

    public static DeliveryResult sent(Long messageId) {
        return new DeliveryResult(true, messageId, null, false);
    }

    public static DeliveryResult dryRunSent() {
        return new DeliveryResult(true, null, null, true);
    }

    public static DeliveryResult failed(String error) {
        return new DeliveryResult(false, null, error, false);
    }
}
