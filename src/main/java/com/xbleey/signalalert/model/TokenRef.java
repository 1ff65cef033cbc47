package com.xbleey.signalalert.model;

import com.xbleey.signalalert.enums.SupportedChain;
import com.xbleey.signalalert.exception.InvalidSignalRequestException;

import java.util.Locale;
import java.util.regex.Pattern;

public record TokenRef(long chainId, String address) {

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[a-fA-F0-9]{40}$");

    public TokenRef {
        if (SupportedChain.fromChainId(chainId).isEmpty()) {
            throw new InvalidSignalRequestException("Chain " + chainId + " not supported");
        }
        address = normalizeAddress(address, "token");
    }

    public static TokenRef of(long chainId, String address) {
        return new TokenRef(chainId, address);
    }

    public SupportedChain chain() {
        return SupportedChain.fromChainId(chainId).orElseThrow();
    }

    public String shortAddress() {
        return address.substring(0, 6) + "..." + address.substring(address.length() - 4);
    }

    public static String normalizeAddress(String address, String field) {
        if (address == null || address.isBlank()) {
            throw new InvalidSignalRequestException("Missing " + field + " address");
        }
        String trimmed = address.trim();
        if (!ADDRESS_PATTERN.matcher(trimmed).matches()) {
            throw new InvalidSignalRequestException("Invalid " + field + " address format: " + trimmed);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
