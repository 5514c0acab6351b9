package com.bank.txnrisk.engine.evaluators;

import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.engine.RuleEvaluator;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.RuleType;
import com.bank.txnrisk.model.ScoreSignal;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Rewards established customers: a recurrent user with enough activity in the
 * last 30 days gets a negative delta. The only rule that lowers the score.
 *
 * Rule params (risk.weights.*):
 *   - "frequency-buffer-reputation" (default: recurrent)
 *   - "frequency-buffer-min-txn30d" (default: 3)
 *   - "frequency-buffer" delta, always <= 0 (default: -1)
 */
@Component
public class FrequencyBufferEvaluator implements RuleEvaluator {

    private final ScoringConfig config;

    public FrequencyBufferEvaluator(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.FREQUENCY_BUFFER;
    }

    @Override
    public Optional<ScoreSignal> evaluate(NormalizedTransaction txn) {
        if (!config.getFrequencyBufferReputation().equals(txn.getUserReputation())
                || txn.getCustomerTxn30d() < config.getFrequencyBufferMinTxn30d()
                || config.getFrequencyBufferWeight() == 0) {
            return Optional.empty();
        }
        return Optional.of(ScoreSignal.of(RuleType.FREQUENCY_BUFFER,
                "frequency_buffer", config.getFrequencyBufferWeight()));
    }
}
