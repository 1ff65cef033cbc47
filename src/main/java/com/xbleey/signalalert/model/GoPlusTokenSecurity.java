package com.xbleey.signalalert.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Subset of the GoPlus token security payload. Flags are "1" / "0" strings, taxes are decimal
 * fractions as strings.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GoPlusTokenSecurity {

    @JsonProperty("is_honeypot")
    private String honeypot;

    @JsonProperty("is_blacklisted")
    private String blacklisted;

    @JsonProperty("is_proxy")
    private String proxy;

    @JsonProperty("is_open_source")
    private String openSource;

    @JsonProperty("can_take_back_ownership")
    private String canTakeBackOwnership;

    @JsonProperty("owner_change_balance")
    private String ownerChangeBalance;

    @JsonProperty("hidden_owner")
    private String hiddenOwner;

    @JsonProperty("selfdestruct")
    private String selfDestruct;

    @JsonProperty("external_call")
    private String externalCall;

    @JsonProperty("is_mintable")
    private String mintable;

    @JsonProperty("transfer_pausable")
    private String transferPausable;

    @JsonProperty("trading_cooldown")
    private String tradingCooldown;

    @JsonProperty("cannot_sell_all")
    private String cannotSellAll;

    @JsonProperty("is_anti_whale")
    private String antiWhale;

    @JsonProperty("buy_tax")
    private String buyTax;

    @JsonProperty("sell_tax")
    private String sellTax;
}
