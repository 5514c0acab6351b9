package com.bank.txnrisk.engine.evaluators;

import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.engine.RuleEvaluator;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.RuleType;
import com.bank.txnrisk.model.ScoreSignal;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Adds a second penalty on top of {@link HighAmountEvaluator} when the high
 * amount comes from a user whose reputation is still "new".
 */
@Component
public class NewUserHighAmountEvaluator implements RuleEvaluator {

    private final ScoringConfig config;

    public NewUserHighAmountEvaluator(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.NEW_USER_HIGH_AMOUNT;
    }

    @Override
    public Optional<ScoreSignal> evaluate(NormalizedTransaction txn) {
        if (!txn.isNewUser() || !HighAmountEvaluator.isHighAmount(config, txn)) {
            return Optional.empty();
        }
        return Optional.of(ScoreSignal.of(RuleType.NEW_USER_HIGH_AMOUNT,
                "new_user_high_amount", config.getNewUserHighAmountWeight()));
    }
}
