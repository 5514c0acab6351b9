package com.bank.txnrisk.engine;

import com.bank.txnrisk.config.MetricsConfig;
import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.engine.evaluators.GeoMismatchEvaluator;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.RuleType;
import com.bank.txnrisk.model.ScoreSignal;
import com.bank.txnrisk.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleEngineTest {

    private final ScoringConfig config = ScoringConfig.defaults();
    private SimpleMeterRegistry registry;
    private RuleEngine ruleEngine;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        ruleEngine = new RuleEngine(TestDataFactory.allEvaluators(config), new MetricsConfig(registry));
    }

    @Test
    void registersEveryRuleTypeInDeclarationOrder() {
        assertThat(ruleEngine.getRegisteredRuleTypes()).containsExactly(RuleType.values());
    }

    @Test
    void evaluateAll_defaultTransaction_noSignals() {
        assertThat(ruleEngine.evaluateAll(TestDataFactory.defaultTransaction(1))).isEmpty();
    }

    @Test
    void evaluateAll_reasonsFollowRuleOrderRegardlessOfRegistrationOrder() {
        NormalizedTransaction txn = NormalizedTransaction.builder()
                .transactionId(42)
                .amountMxn(new BigDecimal("5200.0"))
                .productType("digital")
                .hour(23)
                .ipRisk("medium")
                .emailRisk("new_domain")
                .binCountry("US")
                .ipCountry("MX")
                .build();

        List<ScoreSignal> signals = ruleEngine.evaluateAll(txn);

        assertThat(signals).extracting(ScoreSignal::getReason).containsExactly(
                "high_amount:digital:5200(+2)",
                "new_user_high_amount(+2)",
                "night_hour:23(+1)",
                "geo_mismatch:US!=MX(+2)",
                "ip_risk:medium(+1)",
                "email_risk:new_domain(+2)");
    }

    @Test
    void evaluateAll_repeatedCalls_identicalOutput() {
        NormalizedTransaction txn = NormalizedTransaction.builder()
                .transactionId(7).hour(2).latencyMs(4000).chargebackCount(1).build();

        List<ScoreSignal> first = ruleEngine.evaluateAll(txn);
        for (int i = 0; i < 20; i++) {
            assertThat(ruleEngine.evaluateAll(txn)).isEqualTo(first);
        }
    }

    @Test
    void evaluateAll_recordsTriggeredRuleMetric() {
        ruleEngine.evaluateAll(NormalizedTransaction.builder().transactionId(1).hour(23).build());

        assertThat(registry.get("rule.triggered.count").tag("rule_type", "NIGHT_HOUR").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void constructor_duplicateRuleType_fails() {
        List<RuleEvaluator> evaluators = List.of(new GeoMismatchEvaluator(config), new GeoMismatchEvaluator(config));

        assertThatThrownBy(() -> new RuleEngine(evaluators, new MetricsConfig(registry)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("GEO_MISMATCH");
    }
}
