package com.xbleey.signalalert.service;

import com.xbleey.signalalert.model.FetchResult;
import com.xbleey.signalalert.model.RiskFacts;
import com.xbleey.signalalert.model.TokenRef;

@FunctionalInterface
public interface RiskAdapter {

    FetchResult<RiskFacts> fetchRiskFacts(TokenRef token);
}
