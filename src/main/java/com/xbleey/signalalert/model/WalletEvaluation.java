package com.xbleey.signalalert.model;

import com.xbleey.signalalert.enums.SignalType;

import java.util.Map;

public record WalletEvaluation(String walletAddress, SignalSnapshot snapshot, Map<SignalType, NotificationResult> notifications) {
}
