package com.xbleey.signalalert.controller;

import com.xbleey.signalalert.exception.SubscriptionNotFoundException;
import com.xbleey.signalalert.model.DeliveryResult;
import com.xbleey.signalalert.model.TelegramSettingsRequest;
import com.xbleey.signalalert.model.TelegramSubscription;
import com.xbleey.signalalert.model.TokenRef;
import com.xbleey.signalalert.service.SignalMessageFormatter;
import com.xbleey.signalalert.service.SubscriptionSettingsService;
import com.xbleey.signalalert.service.TelegramNotifier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/telegram")
public class TelegramController {

    private final SubscriptionSettingsService settingsService;
    private final TelegramNotifier notifier;
    private final SignalMessageFormatter formatter;

    public TelegramController(
            SubscriptionSettingsService settingsService,
            TelegramNotifier notifier,
            SignalMessageFormatter formatter
    ) {
        this.settingsService = settingsService;
        this.notifier = notifier;
        this.formatter = formatter;
    }

    @GetMapping("/status")
    public Map<String, Object> status(@RequestParam("wallet") String wallet) {
        Optional<TelegramSubscription> subscription = settingsService.find(wallet);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("configured", notifier.isConfigured());
        response.put("dryRun", notifier.isDryRun());
        response.put("subscription", subscription.map(TelegramController::subscriptionBody).orElse(null));
        return response;
    }

    @PutMapping("/settings")
    public Map<String, Object> updateSettings(@RequestBody TelegramSettingsRequest request) {
        TelegramSubscription updated = settingsService.update(request);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("subscription", subscriptionBody(updated));
        return response;
    }

    @PostMapping("/test")
    public Map<String, Object> test(@RequestParam("wallet") String wallet) {
        String normalized = TokenRef.normalizeAddress(wallet, "wallet");
        TelegramSubscription subscription = settingsService.find(normalized)
                .orElseThrow(() -> new SubscriptionNotFoundException(normalized));
        Map<String, Object> response = new LinkedHashMap<>();
        if (subscription.getChatId() == null) {
            response.put("sent", false);
            response.put("reason", "Telegram not connected");
            return response;
        }
        DeliveryResult result = notifier.send(subscription.getChatId(), formatter.formatTestMessage(normalized));
        response.put("sent", result.success());
        response.put("dryRun", result.dryRun());
        if (result.messageId() != null) {
            response.put("messageId", result.messageId());
        }
        if (result.error() != null) {
            response.put("reason", result.error());
        }
        return response;
    }

    private static Map<String, Object> subscriptionBody(TelegramSubscription subscription) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("enabled", subscription.isEnabled());
        body.put("minImpact", subscription.impactFilter().code());
        body.put("minConfidence", subscription.minConfidenceOrDefault());
        body.put("quietHoursStart", subscription.getQuietHoursStart());
        body.put("quietHoursEnd", subscription.getQuietHoursEnd());
        body.put("connected", subscription.isConnected());
        return body;
    }
}
