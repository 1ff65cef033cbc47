package com.xbleey.signalalert.controller;

import com.xbleey.signalalert.enums.RiskFactor;
import com.xbleey.signalalert.model.AlertState;
import com.xbleey.signalalert.model.CooldownEntry;
import com.xbleey.signalalert.model.DedupFingerprint;
import com.xbleey.signalalert.model.NotificationResult;
import com.xbleey.signalalert.model.RecurrenceInfo;
import com.xbleey.signalalert.model.SignalEvaluation;
import com.xbleey.signalalert.model.SignalObservation;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

final class SignalResponses {

    private SignalResponses() {
    }

    static Map<String, Object> evaluation(SignalEvaluation evaluation) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (evaluation == null) {
            body.put("detected", false);
            return body;
        }
        body.put("type", evaluation.type().code());
        body.put("detected", evaluation.emitted());
        body.put("fetchStatus", evaluation.fetchStatus().name());
        SignalObservation observation = evaluation.observation();
        if (observation != null) {
            body.put("severity", observation.severity().code());
            body.put("confidence", observation.confidence());
            body.put("impact", Map.of(
                    "score", observation.impact().score(),
                    "level", observation.impact().level().code(),
                    "reason", observation.impact().reason()
            ));
            if (!observation.riskFactors().isEmpty()) {
                body.put("factors", observation.riskFactors().stream().map(RiskFactor::code).toList());
                body.put("honeypot", observation.honeypot());
            }
            if (observation.liquidityDropPercent() != null) {
                body.put("dropPercent", observation.liquidityDropPercent());
            }
            if (observation.liquidityUsd() != null) {
                body.put("liquidityUsd", observation.liquidityUsd());
            }
        }
        if (evaluation.suppression() != null) {
            body.put("suppressedBy", evaluation.suppression().code());
        }
        if (evaluation.cooldownRemainingSeconds() != null) {
            body.put("cooldownRemainingSeconds", evaluation.cooldownRemainingSeconds());
        }
        body.put("escalated", evaluation.escalated());
        if (evaluation.previousSeverity() != null) {
            body.put("previousSeverity", evaluation.previousSeverity().code());
        }
        if (evaluation.recurrence() != null) {
            body.put("recurrence", recurrence(evaluation.recurrence()));
        }
        if (evaluation.debugReason() != null) {
            body.put("reason", evaluation.debugReason());
        }
        return body;
    }

    static Map<String, Object> recurrence(RecurrenceInfo info) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("occurrences24h", info.occurrences24h());
        body.put("trend", info.trend().code());
        body.put("isRepeat", info.repeat());
        body.put("previousImpact", info.previousImpact());
        body.put("lastSeen", format(info.lastSeen()));
        body.put("secondsSinceLast", info.secondsSinceLast());
        return body;
    }

    static Map<String, Object> cooldown(CooldownEntry entry, Instant now) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active", entry != null && entry.isActive(now));
        if (entry != null) {
            body.put("severity", entry.lastSeverity().code());
            body.put("startedAt", format(entry.startedAt()));
            body.put("expiresAt", format(entry.expiresAt()));
            body.put("remainingSeconds", entry.remainingSeconds(now));
        }
        return body;
    }

    static Map<String, Object> dedup(DedupFingerprint fingerprint) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active", fingerprint != null);
        if (fingerprint != null) {
            body.put("hash", fingerprint.hash());
            body.put("seenAt", format(fingerprint.seenAt()));
            body.put("expiresAt", format(fingerprint.expiresAt()));
        }
        return body;
    }

    static Map<String, Object> alertState(AlertState state) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("exists", state != null);
        if (state != null) {
            body.put("lastImpact", state.lastImpact().code());
            body.put("lastConfidence", state.lastConfidence());
            body.put("lastLiquidityDrop", state.lastLiquidityDrop());
            body.put("lastAlertAt", format(state.lastAlertAt()));
        }
        return body;
    }

    static Map<String, Object> notification(NotificationResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sent", result.sent());
        if (result.reason() != null) {
            body.put("reason", result.reason());
        }
        if (result.remainingSeconds() != null) {
            body.put("remainingSeconds", result.remainingSeconds());
        }
        if (result.messageId() != null) {
            body.put("messageId", result.messageId());
        }
        if (result.escalationReason() != null) {
            body.put("escalationReason", result.escalationReason().code());
        }
        return body;
    }

    static String format(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
