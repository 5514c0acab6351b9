package com.bank.txnrisk.engine;

import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.RuleType;
import com.bank.txnrisk.model.ScoreSignal;

import java.util.Optional;

/**
 * Interface for all scoring rule evaluators.
 * Each implementation handles a specific RuleType.
 */
public interface RuleEvaluator {

    /**
     * The rule type this evaluator handles.
     */
    RuleType getSupportedRuleType();

    /**
     * Evaluate a normalized transaction.
     * Implementations must be pure: no I/O, no shared mutable state.
     *
     * @param txn the normalized transaction
     * @return the signal if the rule triggered, otherwise empty
     */
    Optional<ScoreSignal> evaluate(NormalizedTransaction txn);
}
