package com.xbleey.signalalert.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.net.URI;
import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "signal")
public class SignalProperties {

    private boolean enabled = true;
    private URI goplusApiUrl;
    private URI dexscreenerApiUrl;
    private Duration riskCacheTtl = Duration.ofMinutes(5);
    private Duration liquidityCacheTtl = Duration.ofMinutes(2);
    private Duration httpTimeout = Duration.ofSeconds(10);

    @PostConstruct
    public void validate() {
        if (goplusApiUrl == null) {
            throw new IllegalStateException("signal.goplusApiUrl must be configured");
        }
        if (dexscreenerApiUrl == null) {
            throw new IllegalStateException("signal.dexscreenerApiUrl must be configured");
        }
        requirePositive(riskCacheTtl, "signal.riskCacheTtl");
        requirePositive(liquidityCacheTtl, "signal.liquidityCacheTtl");
        requirePositive(httpTimeout, "signal.httpTimeout");
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalStateException(name + " must be > 0");
        }
    }
}
