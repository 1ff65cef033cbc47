package com.xbleey.signalalert.service;

import com.xbleey.signalalert.enums.ImpactLevel;
import com.xbleey.signalalert.enums.RiskFactor;
import com.xbleey.signalalert.enums.SignalSeverity;
import com.xbleey.signalalert.enums.SignalType;
import com.xbleey.signalalert.model.LiquidityFacts;
import com.xbleey.signalalert.model.RiskFacts;
import com.xbleey.signalalert.model.SignalObservation;
import com.xbleey.signalalert.support.SignalFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ImpactScorerTest {

    private final ImpactScorer scorer = new ImpactScorer();

    @Test
    void honeypotIsCriticalWithCappedConfidence() {
        SignalObservation observation = scorer.scoreRisk(SignalFixtures.token(), SignalFixtures.honeypotFacts()).orElseThrow();

        assertThat(observation.type()).isEqualTo(SignalType.RISK);
        assertThat(observation.severity()).isEqualTo(SignalSeverity.CRITICAL);
        assertThat(observation.confidence()).isEqualTo(0.95);
        assertThat(observation.impact().score()).isEqualTo(84);
        assertThat(observation.impact().level()).isEqualTo(ImpactLevel.HIGH);
        assertThat(observation.impact().reason()).isEqualTo("Honeypot detected - cannot sell");
        assertThat(observation.riskFactors()).contains(RiskFactor.HONEYPOT);
    }

    @Test
    void singleFactorIsLowImpactWarning() {
        RiskFacts facts = new RiskFacts(List.of(RiskFactor.MINTABLE), false);

        SignalObservation observation = scorer.scoreRisk(SignalFixtures.token(), facts).orElseThrow();

        assertThat(observation.severity()).isEqualTo(SignalSeverity.WARNING);
        assertThat(observation.confidence()).isEqualTo(0.6);
        assertThat(observation.impact().score()).isEqualTo(24);
        assertThat(observation.impact().level()).isEqualTo(ImpactLevel.LOW);
        assertThat(observation.impact().reason()).isEqualTo("1 risk factor: Mintable");
    }

    @Test
    void ownershipControlRaisesConfidence() {
        RiskFacts facts = new RiskFacts(List.of(RiskFactor.HIDDEN_OWNER, RiskFactor.BLACKLISTED, RiskFactor.MINTABLE), false);

        SignalObservation observation = scorer.scoreRisk(SignalFixtures.token(), facts).orElseThrow();

        assertThat(observation.severity()).isEqualTo(SignalSeverity.DANGER);
        assertThat(observation.confidence()).isEqualTo(0.8);
        assertThat(observation.impact().score()).isEqualTo(57);
        assertThat(observation.impact().level()).isEqualTo(ImpactLevel.MEDIUM);
    }

    @Test
    void reasonListsFirstThreeFactorsAndCountsTheRest() {
        RiskFacts facts = new RiskFacts(List.of(
                RiskFactor.ANTI_WHALE,
                RiskFactor.MINTABLE,
                RiskFactor.TRADING_COOLDOWN,
                RiskFactor.EXTERNAL_CALL,
                RiskFactor.TRANSFER_PAUSABLE
        ), false);

        SignalObservation observation = scorer.scoreRisk(SignalFixtures.token(), facts).orElseThrow();

        assertThat(observation.severity()).isEqualTo(SignalSeverity.CRITICAL);
        assertThat(observation.confidence()).isEqualTo(0.75);
        assertThat(observation.impact().score()).isEqualTo(61);
        assertThat(observation.impact().reason())
                .isEqualTo("5 risk factors: External calls, Mintable, Transfers pausable +2 more");
    }

    @Test
    void noFactorsMeansNoRiskSignal() {
        assertThat(scorer.scoreRisk(SignalFixtures.token(), RiskFacts.none())).isEmpty();
    }

    @Test
    void liquidityDropBelowThresholdIsIgnored() {
        assertThat(scorer.scoreLiquidity(SignalFixtures.token(), SignalFixtures.liquidityDrop(29.9))).isEmpty();
    }

    @Test
    void liquidityDropAtThresholdIsScored() {
        SignalObservation observation = scorer.scoreLiquidity(SignalFixtures.token(), SignalFixtures.liquidityDrop(30)).orElseThrow();

        assertThat(observation.type()).isEqualTo(SignalType.LIQUIDITY);
        assertThat(observation.severity()).isEqualTo(SignalSeverity.WARNING);
        assertThat(observation.confidence()).isEqualTo(0.75);
        assertThat(observation.impact().score()).isEqualTo(39);
        assertThat(observation.impact().level()).isEqualTo(ImpactLevel.LOW);
        assertThat(observation.impact().reason()).isEqualTo("30% drop, moderate drop");
        assertThat(observation.liquidityDropPercent()).isEqualTo(30.0);
    }

    @Test
    void mediumAndHighLiquidityBands() {
        SignalObservation medium = SignalFixtures.liquidityObservation(35);
        SignalObservation high = SignalFixtures.liquidityObservation(50);

        assertThat(medium.impact().score()).isEqualTo(49);
        assertThat(medium.impact().level()).isEqualTo(ImpactLevel.MEDIUM);
        assertThat(medium.confidence()).isEqualTo(0.75);
        assertThat(high.severity()).isEqualTo(SignalSeverity.DANGER);
        assertThat(high.impact().score()).isEqualTo(71);
        assertThat(high.impact().level()).isEqualTo(ImpactLevel.HIGH);
        assertThat(high.confidence()).isEqualTo(0.85);
    }

    @Test
    void severeDropInDeepPoolIsCritical() {
        LiquidityFacts facts = new LiquidityFacts(2_000_000.0, -70, 10_000);

        SignalObservation observation = scorer.scoreLiquidity(SignalFixtures.token(), facts).orElseThrow();

        assertThat(observation.severity()).isEqualTo(SignalSeverity.CRITICAL);
        assertThat(observation.impact().score()).isEqualTo(97);
        assertThat(observation.impact().reason()).isEqualTo("70% drop, massive drop, high liquidity");
    }

    @Test
    void missingVolumeLowersConfidence() {
        assertThat(ImpactScorer.liquidityConfidence(50, false)).isEqualTo(0.7);
        assertThat(ImpactScorer.liquidityConfidence(50, true)).isEqualTo(0.85);
    }

    @Test
    void noPoolMeansNoLiquiditySignal() {
        assertThat(scorer.scoreLiquidity(SignalFixtures.token(), LiquidityFacts.noPool())).isEmpty();
    }

    @Test
    void liquidityGainIsNotADrop() {
        assertThat(scorer.scoreLiquidity(SignalFixtures.token(), new LiquidityFacts(50_000.0, 45, 1_000))).isEmpty();
    }

    @Test
    void liquidityReasonNamesDropMagnitude() {
        assertThat(SignalFixtures.liquidityObservation(35).impact().reason()).isEqualTo("35% drop, significant drop");
        assertThat(SignalFixtures.liquidityObservation(50).impact().reason()).isEqualTo("50% drop, severe drop");
    }
}
