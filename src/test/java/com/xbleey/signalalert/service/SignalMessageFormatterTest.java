package com.xbleey.signalalert.service;

import com.xbleey.signalalert.config.TelegramProperties;
import com.xbleey.signalalert.enums.EscalationReason;
import com.xbleey.signalalert.enums.ImpactLevel;
import com.xbleey.signalalert.enums.SignalType;
import com.xbleey.signalalert.support.SignalFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SignalMessageFormatterTest {

    @Test
    void formatsRiskAlert() {
        TelegramProperties properties = new TelegramProperties();
        properties.setRadarUrl("https://radar.example/app");
        SignalMessageFormatter formatter = new SignalMessageFormatter(properties);

        String message = formatter.format(
                SignalFixtures.riskObservation(SignalFixtures.honeypotFacts()),
                "Scam <Token>",
                "SCM",
                EscalationReason.FIRST_ALERT,
                80
        );

        assertThat(message).startsWith("🔴 <b>High Impact ⚠️ Risk Alert</b>");
        assertThat(message).contains("<b>Scam &lt;Token&gt;</b> (SCM) on Ethereum");
        assertThat(message).contains("<b>What changed:</b> Honeypot detected - cannot sell");
        assertThat(message).contains("<b>Confidence:</b> 95%");
        assertThat(message).contains("<i>Why now: First alert for this token</i>");
        assertThat(message).contains("https://dexscreener.com/ethereum/" + SignalFixtures.TOKEN);
        assertThat(message).contains("https://etherscan.io/token/" + SignalFixtures.TOKEN);
        assertThat(message).contains("Open Radar");
        assertThat(message).endsWith("<i>" + SignalMessageFormatter.DISCLAIMER + "</i>");
    }

    @Test
    void fallsBackToShortAddressWithoutName() {
        SignalMessageFormatter formatter = new SignalMessageFormatter(new TelegramProperties());

        String message = formatter.format(SignalFixtures.liquidityObservation(35), null, null,
                EscalationReason.CONFIDENCE_THRESHOLD_CROSSED, 70);

        assertThat(message).contains("<b>0x1111...1111</b> (?)");
        assertThat(message).contains("Why now: Confidence crossed your 70% threshold");
        assertThat(message).doesNotContain("Open Radar");
    }

    @Test
    void guidanceDependsOnTypeAndLevel() {
        assertThat(SignalMessageFormatter.guidance(SignalType.LIQUIDITY, ImpactLevel.HIGH))
                .isEqualTo("Liquidity has dropped significantly. Review trading conditions.");
        assertThat(SignalMessageFormatter.guidance(SignalType.RISK, ImpactLevel.LOW))
                .isEqualTo("Informational only, no immediate action typically needed.");
    }

    @Test
    void testMessageShortensWallet() {
        String message = new SignalMessageFormatter(new TelegramProperties()).formatTestMessage(SignalFixtures.WALLET);

        assertThat(message).contains("<code>0xAbCd...0001</code>");
    }
}
