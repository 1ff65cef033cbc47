package com.xbleey.signalalert.enums;

import lombok.Getter;

import java.util.Optional;

@Getter
public enum SupportedChain {
    ETHEREUM(1, "Ethereum", "ethereum", "https://etherscan.io/token/"),
    OPTIMISM(10, "Optimism", "optimism", "https://optimistic.etherscan.io/token/"),
    BNB_CHAIN(56, "BNB Chain", "bsc", "https://bscscan.com/token/"),
    POLYGON(137, "Polygon", "polygon", "https://polygonscan.com/token/"),
    FANTOM(250, "Fantom", "fantom", "https://ftmscan.com/token/"),
    BASE(8453, "Base", "base", "https://basescan.org/token/"),
    ARBITRUM(42161, "Arbitrum", "arbitrum", "https://arbiscan.io/token/"),
    AVALANCHE(43114, "Avalanche", "avalanche", "https://snowtrace.io/token/");

    private final long chainId;
    private final String displayName;
    private final String dexScreenerSlug;
    private final String explorerTokenUrl;

    SupportedChain(long chainId, String displayName, String dexScreenerSlug, String explorerTokenUrl) {
        this.chainId = chainId;
        this.displayName = displayName;
        this.dexScreenerSlug = dexScreenerSlug;
        this.explorerTokenUrl = explorerTokenUrl;
    }

    public static Optional<SupportedChain> fromChainId(long chainId) {
        for (SupportedChain chain : values()) {
            if (chain.chainId == chainId) {
                return Optional.of(chain);
            }
        }
        return Optional.empty();
    }
}
