package com.bank.txnrisk.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEvaluation(String decision, int riskScore) {
        Counter.builder("evaluation.count")
                .tag("decision", decision)
                .register(registry)
                .increment();

        DistributionSummary.builder("evaluation.risk_score")
                .tag("decision", decision)
                .register(registry)
                .record(riskScore);
    }

    public void recordRuleTriggered(String ruleType) {
        Counter.builder("rule.triggered.count")
                .tag("rule_type", ruleType)
                .register(registry)
                .increment();
    }

    public void recordHardBlock(String name) {
        Counter.builder("hard_block.triggered.count")
                .tag("hard_block", name)
                .register(registry)
                .increment();
    }

    public void recordInvalidInput(String field) {
        Counter.builder("evaluation.invalid_input.count")
                .tag("field", field)
                .register(registry)
                .increment();
    }
}
