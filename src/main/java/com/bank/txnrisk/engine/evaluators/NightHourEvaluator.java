package com.bank.txnrisk.engine.evaluators;

import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.engine.RuleEvaluator;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.RuleType;
import com.bank.txnrisk.model.ScoreSignal;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Flags transactions made inside the night window (default 22:00 to 05:59).
 * Transactions without an hour are never flagged.
 */
@Component
public class NightHourEvaluator implements RuleEvaluator {

    private final ScoringConfig config;

    public NightHourEvaluator(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.NIGHT_HOUR;
    }

    @Override
    public Optional<ScoreSignal> evaluate(NormalizedTransaction txn) {
        Integer hour = txn.getHour();
        if (hour == null || !config.isNightHour(hour)) {
            return Optional.empty();
        }
        return Optional.of(ScoreSignal.of(RuleType.NIGHT_HOUR, "night_hour:" + hour, config.getNightHourWeight()));
    }
}
