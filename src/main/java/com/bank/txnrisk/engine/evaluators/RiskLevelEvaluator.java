package com.bank.txnrisk.engine.evaluators;

import com.bank.txnrisk.engine.RuleEvaluator;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.RuleType;
import com.bank.txnrisk.model.ScoreSignal;

import java.util.Map;
import java.util.Optional;

/**
 * Base class for rules that score a categorical risk level (ip, device
 * fingerprint, email) through a configured level-to-weight table.
 *
 * Levels weighted 0 (e.g. "low") do not produce a signal. The normalizer only
 * lets through levels present in the table, so the lookup always succeeds.
 */
abstract class RiskLevelEvaluator implements RuleEvaluator {

    private final String signalName;

    protected RiskLevelEvaluator(String signalName) {
        this.signalName = signalName;
    }

    protected abstract Map<String, Integer> weights();

    protected abstract String levelOf(NormalizedTransaction txn);

    @Override
    public Optional<ScoreSignal> evaluate(NormalizedTransaction txn) {
        String level = levelOf(txn);
        int weight = weights().getOrDefault(level, 0);
        if (weight == 0) {
            return Optional.empty();
        }
        return Optional.of(ScoreSignal.of(getSupportedRuleType(), signalName + ":" + level, weight));
    }
}
