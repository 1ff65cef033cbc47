package com.xbleey.signalalert.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.signalalert.config.TelegramProperties;
import com.xbleey.signalalert.model.DeliveryResult;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class TelegramNotifier {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int DRY_RUN_PREVIEW_LENGTH = 100;

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final TelegramProperties properties;
    private final Sleeper sleeper;

    @Autowired
    public TelegramNotifier(OkHttpClient okHttpClient, ObjectMapper objectMapper, TelegramProperties properties) {
        this(okHttpClient, objectMapper, properties, Sleeper.threadSleep());
    }

    public TelegramNotifier(OkHttpClient okHttpClient, ObjectMapper objectMapper, TelegramProperties properties, Sleeper sleeper) {
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public boolean isConfigured() {
        return properties.isConfigured();
    }

    public boolean isDryRun() {
        return properties.isDryRun();
    }

    public DeliveryResult send(long chatId, String text) {
        if (properties.isDryRun()) {
            log.info("Telegram dry run, would send to {}: {}", chatId, preview(text));
            return DeliveryResult.dryRunSent();
        }
        if (!properties.hasBotToken()) {
            log.warn("No Telegram bot token configured, skipping notification");
            return DeliveryResult.failed("Telegram not configured");
        }
        Request request;
        try {
            request = buildRequest(chatId, text);
        } catch (IOException ex) {
            log.warn("Failed to build Telegram request", ex);
            return DeliveryResult.failed("Failed to build request");
        }
        int maxAttempts = properties.getMaxAttempts();
        try {
            for (int attempt = 0; attempt < maxAttempts; attempt++) {
                boolean lastAttempt = attempt == maxAttempts - 1;
                try (Response response = okHttpClient.newCall(request).execute()) {
                    JsonNode body = readBody(response.body());
                    if (response.isSuccessful() && body.path("ok").asBoolean(false)) {
                        JsonNode messageId = body.path("result").path("message_id");
                        Long id = messageId.isNumber() ? messageId.asLong() : null;
                        log.info("Telegram message sent to {}, messageId={}", chatId, id);
                        return DeliveryResult.sent(id);
                    }
                    if (response.code() == HTTP_TOO_MANY_REQUESTS) {
                        Duration wait = retryAfter(body, attempt);
                        if (wait.compareTo(properties.getMaxRetryAfter()) > 0) {
                            log.warn("Telegram rate limited for {}s, above the {}s limit, giving up",
                                    wait.toSeconds(), properties.getMaxRetryAfter().toSeconds());
                            return DeliveryResult.failed("Rate limited");
                        }
                        log.warn("Telegram rate limited (attempt {}/{}), waiting {}s",
                                attempt + 1, maxAttempts, wait.toSeconds());
                        if (!lastAttempt) {
                            sleeper.sleep(wait);
                        }
                        continue;
                    }
                    if (response.code() >= 500) {
                        log.warn("Telegram returned http status {} (attempt {}/{})",
                                response.code(), attempt + 1, maxAttempts);
                        if (!lastAttempt) {
                            sleeper.sleep(properties.retryDelay(attempt));
                        }
                        continue;
                    }
                    String description = body.path("description").asText("");
                    String error = description.isBlank() ? "API error (http " + response.code() + ")" : description;
                    log.warn("Telegram API error: {}", error);
                    return DeliveryResult.failed(error);
                } catch (IOException ex) {
                    log.warn("Telegram network error (attempt {}/{})", attempt + 1, maxAttempts, ex);
                    if (!lastAttempt) {
                        sleeper.sleep(properties.retryDelay(attempt));
                    }
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting to retry Telegram delivery");
            return DeliveryResult.failed("Interrupted");
        }
        return DeliveryResult.failed("Max retries exceeded");
    }

    private Request buildRequest(long chatId, String text) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", chatId);
        payload.put("text", text);
        payload.put("parse_mode", "HTML");
        payload.put("disable_web_page_preview", true);
        String url = trimTrailingSlash(properties.getApiBaseUrl().toString())
                + "/bot" + properties.getBotToken() + "/sendMessage";
        return new Request.Builder()
                .url(url)
                .post(RequestBody.create(objectMapper.writeValueAsBytes(payload), JSON))
                .build();
    }

    private JsonNode readBody(ResponseBody body) {
        if (body == null) {
            return objectMapper.createObjectNode();
        }
        try {
            String content = body.string();
            if (content.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(content);
        } catch (IOException ex) {
            log.debug("Telegram response body is not JSON", ex);
            return objectMapper.createObjectNode();
        }
    }

    private Duration retryAfter(JsonNode body, int attempt) {
        JsonNode retryAfter = body.path("parameters").path("retry_after");
        if (retryAfter.canConvertToLong() && retryAfter.asLong() > 0) {
            return Duration.ofSeconds(retryAfter.asLong());
        }
        return properties.retryDelay(attempt);
    }

    private static String preview(String text) {
        if (text == null) {
            return "";
        }
        if (text.length() <= DRY_RUN_PREVIEW_LENGTH) {
            return text;
        }
        return text.substring(0, DRY_RUN_PREVIEW_LENGTH) + "...";
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
