package com.xbleey.signalalert.model;

import com.xbleey.signalalert.enums.EscalationReason;

public record NotificationResult(
        boolean sent,
        String reason,
        Long remainingSeconds,
        Long messageId,
        EscalationReason escalationReason
) {

    public static NotificationResult sent(Long messageId, EscalationReason escalationReason) {
        return new NotificationResult(true, null, null, messageId, escalationReason);
    }

    public static NotificationResult rejected(String reason) {
        return new NotificationResult(false, reason, null, null, null);
    }

    public static NotificationResult rejected(String reason, EscalationReason escalationReason) {
        return new NotificationResult(false, reason, null, null, escalationReason);
    }

    public static NotificationResult coolingDown(long remainingSeconds, EscalationReason escalationReason) {
        return new NotificationResult(
                false,
                "Notification cooldown (" + remainingSeconds + "s remaining)",
                remainingSeconds,
                null,
                escalationReason
        );
    }
}
