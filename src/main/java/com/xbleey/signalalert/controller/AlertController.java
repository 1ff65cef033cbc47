package com.xbleey.signalalert.controller;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.xbleey.signalalert.enums.SignalType;
import com.xbleey.signalalert.exception.InvalidSignalRequestException;
import com.xbleey.signalalert.mapper.SignalAlertHistoryMapper;
import com.xbleey.signalalert.model.SignalAlertHistory;
import com.xbleey.signalalert.model.TokenRef;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/alert")
public class AlertController {

    private final SignalAlertHistoryMapper alertHistoryMapper;

    public AlertController(SignalAlertHistoryMapper alertHistoryMapper) {
        this.alertHistoryMapper = alertHistoryMapper;
    }

    @GetMapping("/list")
    public Map<String, Object> list(
            @RequestParam(name = "pageNum", defaultValue = "1") long pageNum,
            @RequestParam(name = "pageSize", defaultValue = "20") long pageSize,
            @RequestParam(name = "wallet", required = false) String wallet,
            @RequestParam(name = "signalType", required = false) List<String> signalTypes
    ) {
        long safePageNum = Math.max(1L, pageNum);
        long safePageSize = Math.min(Math.max(1L, pageSize), 200L);
        Page<SignalAlertHistory> page = Page.of(safePageNum, safePageSize);

        LambdaQueryWrapper<SignalAlertHistory> wrapper = new LambdaQueryWrapper<>();
        if (wallet != null && !wallet.isBlank()) {
            wrapper.eq(SignalAlertHistory::getWalletAddress, TokenRef.normalizeAddress(wallet, "wallet"));
        }
        List<String> normalizedTypes = normalizeSignalTypes(signalTypes);
        if (!normalizedTypes.isEmpty()) {
            wrapper.in(SignalAlertHistory::getSignalType, normalizedTypes);
        }
        wrapper.orderByDesc(SignalAlertHistory::getSentAt)
                .orderByDesc(SignalAlertHistory::getId);

        Page<SignalAlertHistory> result = alertHistoryMapper.selectPage(page, wrapper);
        return Map.of(
                "current", result.getCurrent(),
                "pageSize", result.getSize(),
                "total", result.getTotal(),
                "pages", result.getPages(),
                "records", result.getRecords()
        );
    }

    private List<String> normalizeSignalTypes(List<String> signalTypes) {
        if (signalTypes == null || signalTypes.isEmpty()) {
            return List.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String value : signalTypes) {
            if (value == null || value.isBlank()) {
                continue;
            }
            for (String part : value.split(",")) {
                String trimmed = part.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                try {
                    normalized.add(SignalType.fromCode(trimmed).code());
                } catch (IllegalArgumentException ex) {
                    throw new InvalidSignalRequestException("Unknown signal type: " + trimmed);
                }
            }
        }
        return List.copyOf(normalized);
    }
}
