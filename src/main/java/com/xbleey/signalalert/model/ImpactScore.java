package com.xbleey.signalalert.model;

import com.xbleey.signalalert.enums.ImpactLevel;

public record ImpactScore(int score, ImpactLevel level, String reason) {
}
