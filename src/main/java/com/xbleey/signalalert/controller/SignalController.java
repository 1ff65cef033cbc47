package com.xbleey.signalalert.controller;

import com.xbleey.signalalert.enums.SignalType;
import com.xbleey.signalalert.model.AlertKey;
import com.xbleey.signalalert.model.NotificationResult;
import com.xbleey.signalalert.model.SignalKey;
import com.xbleey.signalalert.model.SignalSnapshot;
import com.xbleey.signalalert.model.TokenRef;
import com.xbleey.signalalert.model.WalletEvaluation;
import com.xbleey.signalalert.service.AlertStateStore;
import com.xbleey.signalalert.service.NotificationCooldownTracker;
import com.xbleey.signalalert.service.SignalCooldownTracker;
import com.xbleey.signalalert.service.SignalDedupGuard;
import com.xbleey.signalalert.service.SignalEvaluator;
import com.xbleey.signalalert.service.SignalRecurrenceTracker;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class SignalController {

    static final String SIGNALS_PATH = "/api/v1/signals";

    private final SignalEvaluator evaluator;
    private final SignalCooldownTracker cooldownTracker;
    private final SignalDedupGuard dedupGuard;
    private final SignalRecurrenceTracker recurrenceTracker;
    private final NotificationCooldownTracker notificationCooldownTracker;
    private final AlertStateStore alertStateStore;
    private final Clock clock;

    public SignalController(
            SignalEvaluator evaluator,
            SignalCooldownTracker cooldownTracker,
            SignalDedupGuard dedupGuard,
            SignalRecurrenceTracker recurrenceTracker,
            NotificationCooldownTracker notificationCooldownTracker,
            AlertStateStore alertStateStore,
            Clock clock
    ) {
        this.evaluator = evaluator;
        this.cooldownTracker = cooldownTracker;
        this.dedupGuard = dedupGuard;
        this.recurrenceTracker = recurrenceTracker;
        this.notificationCooldownTracker = notificationCooldownTracker;
        this.alertStateStore = alertStateStore;
        this.clock = clock;
    }

    @GetMapping(SIGNALS_PATH)
    public Map<String, Object> signals(
            @RequestParam("chainId") long chainId,
            @RequestParam("token") String token,
            @RequestParam(name = "debug", defaultValue = "false") boolean debug
    ) {
        TokenRef tokenRef = TokenRef.of(chainId, token);
        SignalSnapshot snapshot = evaluator.evaluate(tokenRef);
        Map<String, Object> response = snapshotBody(snapshot);
        if (debug) {
            response.put("debug", tokenState(tokenRef));
        }
        return response;
    }

    @GetMapping("/api/signals")
    public ResponseEntity<Void> legacySignals(HttpServletRequest request) {
        String query = request.getQueryString();
        String location = query == null || query.isBlank() ? SIGNALS_PATH : SIGNALS_PATH + "?" + query;
        return ResponseEntity.status(HttpStatus.MOVED_PERMANENTLY)
                .header(HttpHeaders.LOCATION, location)
                .build();
    }

    @PostMapping(SIGNALS_PATH + "/evaluate")
    public Map<String, Object> evaluate(
            @RequestParam("wallet") String wallet,
            @RequestParam("chainId") long chainId,
            @RequestParam("token") String token,
            @RequestParam(name = "tokenName", required = false) String tokenName,
            @RequestParam(name = "tokenSymbol", required = false) String tokenSymbol
    ) {
        TokenRef tokenRef = TokenRef.of(chainId, token);
        WalletEvaluation evaluation = evaluator.evaluateForWallet(wallet, tokenRef, tokenName, tokenSymbol);
        Map<String, Object> response = snapshotBody(evaluation.snapshot());
        response.put("wallet", evaluation.walletAddress());
        Map<String, Object> notifications = new LinkedHashMap<>();
        for (Map.Entry<SignalType, NotificationResult> entry : evaluation.notifications().entrySet()) {
            notifications.put(entry.getKey().code(), SignalResponses.notification(entry.getValue()));
        }
        response.put("notifications", notifications);
        return response;
    }

    @GetMapping(SIGNALS_PATH + "/status")
    public Map<String, Object> status(
            @RequestParam("chainId") long chainId,
            @RequestParam("token") String token,
            @RequestParam(name = "wallet", required = false) String wallet
    ) {
        TokenRef tokenRef = TokenRef.of(chainId, token);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("chainId", tokenRef.chainId());
        response.put("token", tokenRef.address());
        response.put("timestamp", Instant.now(clock).toString());
        response.put("signals", tokenState(tokenRef));
        if (wallet != null && !wallet.isBlank()) {
            String normalizedWallet = TokenRef.normalizeAddress(wallet, "wallet");
            response.put("wallet", normalizedWallet);
            response.put("notifications", walletState(normalizedWallet, tokenRef));
        }
        return response;
    }

    private Map<String, Object> snapshotBody(SignalSnapshot snapshot) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("chainId", snapshot.token().chainId());
        response.put("token", snapshot.token().address());
        response.put("enabled", snapshot.enabled());
        response.put("evaluatedAt", snapshot.evaluatedAt().toString());
        Map<String, Object> signals = new LinkedHashMap<>();
        if (snapshot.enabled()) {
            signals.put(SignalType.RISK.code(), SignalResponses.evaluation(snapshot.risk()));
            signals.put(SignalType.LIQUIDITY.code(), SignalResponses.evaluation(snapshot.liquidity()));
        }
        response.put("signals", signals);
        return response;
    }

    private Map<String, Object> tokenState(TokenRef tokenRef) {
        Instant now = Instant.now(clock);
        Map<String, Object> state = new LinkedHashMap<>();
        for (SignalType type : SignalType.values()) {
            SignalKey key = SignalKey.of(tokenRef, type);
            Map<String, Object> perType = new LinkedHashMap<>();
            perType.put("cooldown", SignalResponses.cooldown(cooldownTracker.activeEntry(key).orElse(null), now));
            perType.put("dedup", SignalResponses.dedup(dedupGuard.status(key).orElse(null)));
            perType.put("occurrences24h", recurrenceTracker.history(key).size());
            state.put(type.code(), perType);
        }
        return state;
    }

    private Map<String, Object> walletState(String wallet, TokenRef tokenRef) {
        Map<String, Object> state = new LinkedHashMap<>();
        for (SignalType type : SignalType.values()) {
            Map<String, Object> perType = new LinkedHashMap<>();
            String cooldownKey = NotificationCooldownTracker.key(wallet, tokenRef, type);
            perType.put("channelCooldown", notificationCooldownTracker.find(cooldownKey)
                    .map(entry -> {
                        Map<String, Object> body = new LinkedHashMap<>();
                        body.put("lastSentAt", entry.lastSentAt().toString());
                        body.put("lastLevel", entry.lastLevel().code());
                        body.put("remainingSeconds",
                                notificationCooldownTracker.remainingSeconds(cooldownKey, null).orElse(0));
                        return body;
                    })
                    .orElse(null));
            perType.put("alertState", SignalResponses.alertState(
                    alertStateStore.find(new AlertKey(wallet, tokenRef.address(), type)).orElse(null)));
            state.put(type.code(), perType);
        }
        return state;
    }
}
