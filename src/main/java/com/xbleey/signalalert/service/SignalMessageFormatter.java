package com.xbleey.signalalert.service;

import com.xbleey.signalalert.config.TelegramProperties;
import com.xbleey.signalalert.enums.EscalationReason;
import com.xbleey.signalalert.enums.ImpactLevel;
import com.xbleey.signalalert.enums.SignalType;
import com.xbleey.signalalert.enums.SupportedChain;
import com.xbleey.signalalert.model.SignalObservation;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

@Component
public class SignalMessageFormatter {

    static final String DISCLAIMER = "This is informational only, not financial advice.";

    private final TelegramProperties properties;

    public SignalMessageFormatter(TelegramProperties properties) {
        this.properties = properties;
    }

    public String format(
            SignalObservation observation,
            String tokenName,
            String tokenSymbol,
            EscalationReason escalationReason,
            int confidenceThresholdPercent
    ) {
        ImpactLevel level = observation.impact().level();
        SupportedChain chain = observation.token().chain();
        String address = observation.token().address();
        String name = escape(tokenName == null || tokenName.isBlank() ? observation.token().shortAddress() : tokenName);
        String symbol = escape(tokenSymbol == null || tokenSymbol.isBlank() ? "?" : tokenSymbol);

        StringBuilder message = new StringBuilder();
        message.append(impactEmoji(level)).append(" <b>")
                .append(level.getLabel()).append(" Impact ")
                .append(observation.type() == SignalType.RISK ? "⚠️" : "💧").append(' ')
                .append(observation.type().getLabel()).append(" Alert</b>\n\n");
        message.append("<b>").append(name).append("</b> (").append(symbol).append(") on ")
                .append(chain.getDisplayName()).append("\n\n");
        message.append("<b>What changed:</b> ").append(escape(observation.impact().reason())).append('\n');
        message.append("<b>Confidence:</b> ").append(observation.confidencePercent()).append("%\n\n");
        if (escalationReason != null) {
            message.append("<i>").append(escape(escalationReason.whyNowText(confidenceThresholdPercent))).append("</i>\n\n");
        }
        message.append("<b>Suggested:</b> ").append(guidance(observation.type(), level)).append("\n\n");
        message.append("🔗 <a href=\"https://dexscreener.com/").append(chain.getDexScreenerSlug()).append('/')
                .append(address).append("\">DexScreener</a> | <a href=\"")
                .append(chain.getExplorerTokenUrl()).append(address).append("\">Explorer</a>");
        if (properties.getRadarUrl() != null && !properties.getRadarUrl().isBlank()) {
            message.append(" | <a href=\"").append(escape(properties.getRadarUrl())).append("\">Open Radar</a>");
        }
        message.append("\n\n<i>").append(DISCLAIMER).append("</i>");
        return message.toString();
    }

    public String formatTestMessage(String walletAddress) {
        String shortWallet = walletAddress.length() > 10
                ? walletAddress.substring(0, 6) + "..." + walletAddress.substring(walletAddress.length() - 4)
                : walletAddress;
        return "✅ <b>Test notification</b>\n\n"
                + "Alerts for wallet <code>" + escape(shortWallet) + "</code> are delivered to this chat.\n\n"
                + "<i>" + DISCLAIMER + "</i>";
    }

    static String guidance(SignalType type, ImpactLevel level) {
        if (type == SignalType.RISK) {
            return switch (level) {
                case HIGH -> "Review token details and consider your position carefully.";
                case MEDIUM -> "Review the risk indicators when convenient.";
                case LOW -> "Informational only, no immediate action typically needed.";
            };
        }
        return switch (level) {
            case HIGH -> "Liquidity has dropped significantly. Review trading conditions.";
            case MEDIUM -> "Monitor liquidity conditions.";
            case LOW -> "Minor liquidity change, informational only.";
        };
    }

    private static String impactEmoji(ImpactLevel level) {
        return switch (level) {
            case HIGH -> "🔴";
            case MEDIUM -> "🟡";
            case LOW -> "ℹ️";
        };
    }

    private static String escape(String value) {
        return HtmlUtils.htmlEscape(value);
    }
}
