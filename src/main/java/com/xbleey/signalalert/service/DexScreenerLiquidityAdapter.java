package com.xbleey.signalalert.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.signalalert.config.SignalProperties;
import com.xbleey.signalalert.model.FetchResult;
import com.xbleey.signalalert.model.LiquidityFacts;
import com.xbleey.signalalert.model.TokenRef;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DexScreenerLiquidityAdapter implements LiquidityAdapter {

    private static final Logger log = LoggerFactory.getLogger(DexScreenerLiquidityAdapter.class);

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final SignalProperties properties;

    public DexScreenerLiquidityAdapter(OkHttpClient okHttpClient, ObjectMapper objectMapper, SignalProperties properties) {
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public FetchResult<LiquidityFacts> fetchLiquidityFacts(TokenRef token) {
        HttpUrl url = HttpUrl.get(properties.getDexscreenerApiUrl().toString()).newBuilder()
                .addPathSegments("latest/dex/tokens")
                .addPathSegment(token.address())
                .build();
        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .get()
                .build();
        try (Response httpResponse = okHttpClient.newCall(request).execute()) {
            if (!httpResponse.isSuccessful()) {
                log.warn("DexScreener returned http status {} for {}", httpResponse.code(), token.address());
                return FetchResult.unavailable("Liquidity provider returned http " + httpResponse.code());
            }
            if (httpResponse.body() == null) {
                log.warn("DexScreener returned empty body for {}", token.address());
                return FetchResult.unavailable("Liquidity provider returned empty body");
            }
            JsonNode root = objectMapper.readTree(httpResponse.body().byteStream());
            JsonNode pair = selectPair(root.path("pairs"), token.chain().getDexScreenerSlug());
            if (pair == null) {
                return FetchResult.ok(LiquidityFacts.noPool());
            }
            JsonNode liquidityUsd = pair.path("liquidity").path("usd");
            if (!liquidityUsd.isNumber() || liquidityUsd.asDouble() <= 0) {
                return FetchResult.ok(LiquidityFacts.noPool());
            }
            double change = pair.path("liquidityChange").path("m10").asDouble(0);
            double volume = pair.path("volume").path("h24").asDouble(0);
            return FetchResult.ok(new LiquidityFacts(liquidityUsd.asDouble(), change, volume));
        } catch (Exception ex) {
            log.warn("Failed to fetch liquidity for {}", token.address(), ex);
            return FetchResult.unavailable("Liquidity provider unavailable: " + ex.getClass().getSimpleName());
        }
    }

    // Pairs without a chain id count as matching.
    private static JsonNode selectPair(JsonNode pairs, String chainSlug) {
        if (pairs == null || !pairs.isArray() || pairs.isEmpty()) {
            return null;
        }
        JsonNode best = null;
        double bestLiquidity = -1;
        for (JsonNode pair : pairs) {
            String pairChain = pair.path("chainId").asText("");
            if (!pairChain.isEmpty() && !pairChain.equalsIgnoreCase(chainSlug)) {
                continue;
            }
            double liquidity = pair.path("liquidity").path("usd").asDouble(0);
            if (liquidity > bestLiquidity) {
                best = pair;
                bestLiquidity = liquidity;
            }
        }
        return best;
    }
}
