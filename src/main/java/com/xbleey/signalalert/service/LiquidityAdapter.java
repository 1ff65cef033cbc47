package com.xbleey.signalalert.service;

import com.xbleey.signalalert.model.FetchResult;
import com.xbleey.signalalert.model.LiquidityFacts;
import com.xbleey.signalalert.model.TokenRef;

@FunctionalInterface
public interface LiquidityAdapter {

    FetchResult<LiquidityFacts> fetchLiquidityFacts(TokenRef token);
}
