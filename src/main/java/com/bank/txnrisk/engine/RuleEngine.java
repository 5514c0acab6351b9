package com.bank.txnrisk.engine;

import com.bank.txnrisk.config.MetricsConfig;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.RuleType;
import com.bank.txnrisk.model.ScoreSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Core rule engine that evaluates every registered rule against a transaction.
 * Uses the Strategy pattern: each RuleType is handled by a registered RuleEvaluator.
 * Rules run in RuleType declaration order so the reasons come out in a stable order.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final Map<RuleType, RuleEvaluator> evaluatorMap;
    private final MetricsConfig metricsConfig;

    public RuleEngine(List<RuleEvaluator> evaluators, MetricsConfig metricsConfig) {
        this.evaluatorMap = new EnumMap<>(RuleType.class);
        this.metricsConfig = metricsConfig;

        // Auto-register all evaluator implementations
        for (RuleEvaluator evaluator : evaluators) {
            RuleEvaluator previous = evaluatorMap.put(evaluator.getSupportedRuleType(), evaluator);
            if (previous != null) {
                throw new IllegalStateException("Duplicate evaluators for rule type "
                        + evaluator.getSupportedRuleType() + ": "
                        + previous.getClass().getSimpleName() + ", " + evaluator.getClass().getSimpleName());
            }
            log.info("Registered rule evaluator: {} -> {}",
                    evaluator.getSupportedRuleType(), evaluator.getClass().getSimpleName());
        }
    }

    /**
     * Evaluate all registered rules against the given transaction.
     *
     * @param txn the normalized transaction
     * @return signals of the triggered rules, in evaluation order
     */
    public List<ScoreSignal> evaluateAll(NormalizedTransaction txn) {
        List<ScoreSignal> signals = new ArrayList<>();

        for (RuleEvaluator evaluator : evaluatorMap.values()) {
            Optional<ScoreSignal> signal = evaluator.evaluate(txn);
            if (signal.isPresent()) {
                signals.add(signal.get());
                metricsConfig.recordRuleTriggered(evaluator.getSupportedRuleType().name());
                log.debug("Rule triggered: {} for txn {}: {}",
                        evaluator.getSupportedRuleType(), txn.getTransactionId(), signal.get().getReason());
            }
        }

        return signals;
    }

    public List<RuleType> getRegisteredRuleTypes() {
        return Collections.unmodifiableList(new ArrayList<>(evaluatorMap.keySet()));
    }
}
