package com.xbleey.signalalert.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.signalalert.config.SignalProperties;
import com.xbleey.signalalert.enums.FetchStatus;
import com.xbleey.signalalert.model.FetchResult;
import com.xbleey.signalalert.model.LiquidityFacts;
import com.xbleey.signalalert.support.SignalFixtures;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class DexScreenerLiquidityAdapterTest {

    private MockWebServer server;
    private DexScreenerLiquidityAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        SignalProperties properties = new SignalProperties();
        properties.setGoplusApiUrl(server.url("/").uri());
        properties.setDexscreenerApiUrl(server.url("/").uri());
        adapter = new DexScreenerLiquidityAdapter(new OkHttpClient(), new ObjectMapper(), properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void picksDeepestPairOnTokenChain() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("""
                        {"pairs":[
                          {"chainId":"bsc","liquidity":{"usd":900000},"liquidityChange":{"m10":-80},"volume":{"h24":1}},
                          {"chainId":"ethereum","liquidity":{"usd":20000},"liquidityChange":{"m10":-5},"volume":{"h24":100}},
                          {"chainId":"ethereum","liquidity":{"usd":50000},"liquidityChange":{"m10":-42.5},"volume":{"h24":1200}}
                        ]}
                        """));

        FetchResult<LiquidityFacts> result = adapter.fetchLiquidityFacts(SignalFixtures.token());

        assertThat(result.status()).isEqualTo(FetchStatus.OK);
        assertThat(result.data().liquidityUsd()).isEqualTo(50_000.0);
        assertThat(result.data().changePercent()).isEqualTo(-42.5);
        assertThat(result.data().volume24hUsd()).isEqualTo(1200.0);
        assertThat(server.takeRequest().getPath()).isEqualTo("/latest/dex/tokens/" + SignalFixtures.TOKEN);
    }

    @Test
    void noPairsMeansNoPool() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"schemaVersion\":\"1.0.0\",\"pairs\":null}"));

        FetchResult<LiquidityFacts> result = adapter.fetchLiquidityFacts(SignalFixtures.token());

        assertThat(result.status()).isEqualTo(FetchStatus.OK);
        assertThat(result.data().hasPool()).isFalse();
    }

    @Test
    void pairsOnOtherChainsMeanNoPool() {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("{\"pairs\":[{\"chainId\":\"base\",\"liquidity\":{\"usd\":1000}}]}"));

        assertThat(adapter.fetchLiquidityFacts(SignalFixtures.token()).data().hasPool()).isFalse();
    }

    @Test
    void missingChangeCountsAsZero() {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("{\"pairs\":[{\"liquidity\":{\"usd\":1000}}]}"));

        LiquidityFacts facts = adapter.fetchLiquidityFacts(SignalFixtures.token()).data();

        assertThat(facts.hasPool()).isTrue();
        assertThat(facts.dropPercent()).isZero();
        assertThat(facts.hasVolume()).isFalse();
    }

    @Test
    void httpErrorIsUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(429));

        FetchResult<LiquidityFacts> result = adapter.fetchLiquidityFacts(SignalFixtures.token());

        assertThat(result.status()).isEqualTo(FetchStatus.UNAVAILABLE);
        assertThat(result.reason()).isEqualTo("Liquidity provider returned http 429");
    }
}
