package com.xbleey.signalalert.model;

import com.xbleey.signalalert.enums.FetchStatus;
import com.xbleey.signalalert.enums.SignalSeverity;
import com.xbleey.signalalert.enums.SignalType;
import com.xbleey.signalalert.enums.SuppressionReason;

public record SignalEvaluation(
        SignalType type,
        FetchStatus fetchStatus,
        SignalObservation observation,
        boolean emitted,
        SuppressionReason suppression,
        boolean escalated,
        SignalSeverity previousSeverity,
        Long cooldownRemainingSeconds,
        RecurrenceInfo recurrence,
        String debugReason
) {

    public static SignalEvaluation noSignal(SignalType type, FetchStatus fetchStatus, String debugReason) {
        return new SignalEvaluation(type, fetchStatus, null, false, null, false, null, null, null, debugReason);
    }

    public static SignalEvaluation duplicate(SignalObservation observation, FetchStatus fetchStatus) {
        return new SignalEvaluation(observation.type(), fetchStatus, observation, false,
                SuppressionReason.DUPLICATE, false, null, null, null, "Identical state seen within dedup window");
    }

    public static SignalEvaluation coolingDown(
            SignalObservation observation,
            FetchStatus fetchStatus,
            CooldownAdmission admission,
            long remainingSeconds
    ) {
        return new SignalEvaluation(observation.type(), fetchStatus, observation, false,
                SuppressionReason.COOLDOWN, false, admission.previousSeverity(), remainingSeconds, null,
                "Cooldown active at severity " + admission.entry().lastSeverity().code());
    }

    public static SignalEvaluation emitted(
            SignalObservation observation,
            FetchStatus fetchStatus,
            CooldownAdmission admission,
            RecurrenceInfo recurrence,
            String debugReason
    ) {
        return new SignalEvaluation(observation.type(), fetchStatus, observation, true, null,
                admission.escalated(), admission.previousSeverity(), null, recurrence, debugReason);
    }

    public boolean hasSignal() {
        return observation != null;
    }
}
