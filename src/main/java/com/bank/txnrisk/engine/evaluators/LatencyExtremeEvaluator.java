package com.bank.txnrisk.engine.evaluators;

import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.engine.RuleEvaluator;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.RuleType;
import com.bank.txnrisk.model.ScoreSignal;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Flags requests whose client-observed latency exceeds the configured limit.
 * Very slow requests are typical of scripted or proxied sessions.
 */
@Component
public class LatencyExtremeEvaluator implements RuleEvaluator {

    private final ScoringConfig config;

    public LatencyExtremeEvaluator(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.LATENCY_EXTREME;
    }

    @Override
    public Optional<ScoreSignal> evaluate(NormalizedTransaction txn) {
        if (txn.getLatencyMs() <= config.getLatencyExtremeMs()) {
            return Optional.empty();
        }
        return Optional.of(ScoreSignal.of(RuleType.LATENCY_EXTREME,
                "latency_extreme:" + txn.getLatencyMs() + "ms", config.getLatencyExtremeWeight()));
    }
}
