package com.xbleey.signalalert.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.signalalert.config.SignalProperties;
import com.xbleey.signalalert.enums.RiskFactor;
import com.xbleey.signalalert.model.FetchResult;
import com.xbleey.signalalert.model.GoPlusResponse;
import com.xbleey.signalalert.model.GoPlusTokenSecurity;
import com.xbleey.signalalert.model.RiskFacts;
import com.xbleey.signalalert.model.TokenRef;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class GoPlusRiskAdapter implements RiskAdapter {

    private static final Logger log = LoggerFactory.getLogger(GoPlusRiskAdapter.class);
    private static final double HIGH_TAX_PERCENT = 10.0;

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final SignalProperties properties;

    public GoPlusRiskAdapter(OkHttpClient okHttpClient, ObjectMapper objectMapper, SignalProperties properties) {
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public FetchResult<RiskFacts> fetchRiskFacts(TokenRef token) {
        HttpUrl baseUrl = HttpUrl.get(properties.getGoplusApiUrl().toString());
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("token_security")
                .addPathSegment(String.valueOf(token.chainId()))
                .addQueryParameter("contract_addresses", token.address())
                .build();
        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .get()
                .build();
        try (Response httpResponse = okHttpClient.newCall(request).execute()) {
            if (!httpResponse.isSuccessful()) {
                log.warn("GoPlus returned http status {} for {}", httpResponse.code(), token.address());
                return FetchResult.unavailable("Risk provider returned http " + httpResponse.code());
            }
            if (httpResponse.body() == null) {
                log.warn("GoPlus returned empty body for {}", token.address());
                return FetchResult.unavailable("Risk provider returned empty body");
            }
            GoPlusResponse response = objectMapper.readValue(httpResponse.body().byteStream(), GoPlusResponse.class);
            if (response.getCode() == null || response.getCode() != GoPlusResponse.CODE_OK) {
                log.info("GoPlus has no data for {}: {}", token.address(), response.getMessage());
                return FetchResult.ok(RiskFacts.none());
            }
            GoPlusTokenSecurity security = response.getResult() == null ? null : response.getResult().get(token.address());
            if (security == null) {
                return FetchResult.ok(RiskFacts.none());
            }
            return FetchResult.ok(toFacts(security));
        } catch (Exception ex) {
            log.warn("Failed to fetch token security for {}", token.address(), ex);
            return FetchResult.unavailable("Risk provider unavailable: " + ex.getClass().getSimpleName());
        }
    }

    static RiskFacts toFacts(GoPlusTokenSecurity security) {
        List<RiskFactor> factors = new ArrayList<>();
        boolean honeypot = isSet(security.getHoneypot());
        if (isSet(security.getBlacklisted())) {
            factors.add(RiskFactor.BLACKLISTED);
        }
        if (isSet(security.getProxy()) && !isSet(security.getOpenSource())) {
            factors.add(RiskFactor.UNVERIFIED_PROXY);
        }
        if (isSet(security.getCanTakeBackOwnership())) {
            factors.add(RiskFactor.TAKE_BACK_OWNERSHIP);
        }
        if (isSet(security.getOwnerChangeBalance())) {
            factors.add(RiskFactor.OWNER_CHANGE_BALANCE);
        }
        if (isSet(security.getHiddenOwner())) {
            factors.add(RiskFactor.HIDDEN_OWNER);
        }
        if (isSet(security.getSelfDestruct())) {
            factors.add(RiskFactor.SELF_DESTRUCT);
        }
        if (isSet(security.getExternalCall())) {
            factors.add(RiskFactor.EXTERNAL_CALL);
        }
        if (isSet(security.getMintable())) {
            factors.add(RiskFactor.MINTABLE);
        }
        if (isSet(security.getTransferPausable())) {
            factors.add(RiskFactor.TRANSFER_PAUSABLE);
        }
        if (isSet(security.getTradingCooldown())) {
            factors.add(RiskFactor.TRADING_COOLDOWN);
        }
        if (isSet(security.getCannotSellAll())) {
            factors.add(RiskFactor.CANNOT_SELL_ALL);
        }
        if (isSet(security.getAntiWhale())) {
            factors.add(RiskFactor.ANTI_WHALE);
        }
        if (taxPercent(security.getBuyTax()) > HIGH_TAX_PERCENT) {
            factors.add(RiskFactor.HIGH_BUY_TAX);
        }
        if (taxPercent(security.getSellTax()) > HIGH_TAX_PERCENT) {
            factors.add(RiskFactor.HIGH_SELL_TAX);
        }
        return new RiskFacts(factors, honeypot);
    }

    private static boolean isSet(String flag) {
        return "1".equals(flag == null ? null : flag.trim());
    }

    // GoPlus 返回小数比例（0.12 表示 12%），个别链直接返回百分比
    static double taxPercent(String tax) {
        if (tax == null || tax.isBlank()) {
            return 0;
        }
        try {
            double value = Double.parseDouble(tax.trim());
            return value <= 1 ? value * 100 : value;
        } catch (NumberFormatException ex) {
            return 0;
        }
    }
}
