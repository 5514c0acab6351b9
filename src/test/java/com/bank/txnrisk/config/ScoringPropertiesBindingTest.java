package com.bank.txnrisk.config;

import com.bank.txnrisk.model.Decision;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Overrides reach the scoring bean through application.yml: environment
 * placeholders, plain keys and bracketed map keys.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
        "REJECT_AT=12",
        "risk.review-at=5",
        "AMOUNT_THRESHOLD_DIGITAL=3000",
        "LATENCY_EXTREME_MS=4000",
        "risk.weights.email-risk[new_domain]=4"
})
class ScoringPropertiesBindingTest {

    @Autowired
    private ScoringConfig scoringConfig;

    @Test
    void thresholds_followOverrides() {
        assertThat(scoringConfig.getScoreToDecision()).hasSize(2);
        assertThat(scoringConfig.getScoreToDecision().get(0).getMinScore()).isEqualTo(12);
        assertThat(scoringConfig.getScoreToDecision().get(1).getMinScore()).isEqualTo(5);
        assertThat(scoringConfig.decisionFor(11)).isEqualTo(Decision.IN_REVIEW);
        assertThat(scoringConfig.decisionFor(4)).isEqualTo(Decision.ACCEPTED);
    }

    @Test
    void amountBandsAndLatency_followEnvironmentPlaceholders() {
        assertThat(scoringConfig.getAmountThresholds()).containsEntry("digital", new BigDecimal("3000"));
        assertThat(scoringConfig.getAmountThresholds()).containsEntry("default", new BigDecimal("5000"));
        assertThat(scoringConfig.getLatencyExtremeMs()).isEqualTo(4000L);
    }

    @Test
    void emailRisk_bracketedKeyBindsWithoutExtraLevels() {
        assertThat(scoringConfig.getEmailRiskWeights())
                .containsOnlyKeys("low", "new_domain", "high")
                .containsEntry("new_domain", 4)
                .containsEntry("high", 3);
    }
}
