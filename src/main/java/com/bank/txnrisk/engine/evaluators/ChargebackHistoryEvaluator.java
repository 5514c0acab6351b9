package com.bank.txnrisk.engine.evaluators;

import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.engine.RuleEvaluator;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.RuleType;
import com.bank.txnrisk.model.ScoreSignal;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Penalises customers with past chargebacks. The stronger chargeback + high
 * IP risk combination is handled separately as a hard block.
 */
@Component
public class ChargebackHistoryEvaluator implements RuleEvaluator {

    private final ScoringConfig config;

    public ChargebackHistoryEvaluator(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.CHARGEBACK_HISTORY;
    }

    @Override
    public Optional<ScoreSignal> evaluate(NormalizedTransaction txn) {
        if (txn.getChargebackCount() < config.getMinChargebacks()) {
            return Optional.empty();
        }
        return Optional.of(ScoreSignal.of(RuleType.CHARGEBACK_HISTORY,
                "chargeback_history:" + txn.getChargebackCount(), config.getChargebackHistoryWeight()));
    }
}
