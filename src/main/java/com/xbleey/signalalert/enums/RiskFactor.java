package com.xbleey.signalalert.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum RiskFactor {
    HONEYPOT("honeypot", "Honeypot", false, true),
    BLACKLISTED("blacklisted", "Blacklist function", false, true),
    SELF_DESTRUCT("can_selfdestruct", "Self-destruct", false, true),
    OWNER_CHANGE_BALANCE("owner_can_modify_balance", "Owner can modify balances", true, true),
    HIDDEN_OWNER("hidden_owner", "Hidden owner", true, false),
    TAKE_BACK_OWNERSHIP("can_take_back_ownership", "Can reclaim ownership", true, false),
    UNVERIFIED_PROXY("unverified_proxy", "Unverified proxy", false, false),
    EXTERNAL_CALL("external_call", "External calls", false, false),
    MINTABLE("mintable", "Mintable", false, false),
    TRANSFER_PAUSABLE("transfer_pausable", "Transfers pausable", false, false),
    TRADING_COOLDOWN("trading_cooldown", "Trading cooldown", false, false),
    CANNOT_SELL_ALL("cannot_sell_all", "Sell restrictions", false, false),
    ANTI_WHALE("anti_whale", "Anti-whale limits", false, false),
    HIGH_BUY_TAX("high_buy_tax", "High buy tax", false, false),
    HIGH_SELL_TAX("high_sell_tax", "High sell tax", false, false);

    private final String code;
    private final String label;
    private final boolean ownershipControl;
    private final boolean critical;

    RiskFactor(String code, String label, boolean ownershipControl, boolean critical) {
        this.code = code;
        this.label = label;
        this.ownershipControl = ownershipControl;
        this.critical = critical;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
