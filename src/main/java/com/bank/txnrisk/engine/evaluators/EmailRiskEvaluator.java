package com.bank.txnrisk.engine.evaluators;

import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Scores the email risk level, e.g. a freshly registered domain ("new_domain").
 */
@Component
public class EmailRiskEvaluator extends RiskLevelEvaluator {

    private final ScoringConfig config;

    public EmailRiskEvaluator(ScoringConfig config) {
        super("email_risk");
        this.config = config;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.EMAIL_RISK;
    }

    @Override
    protected Map<String, Integer> weights() {
        return config.getEmailRiskWeights();
    }

    @Override
    protected String levelOf(NormalizedTransaction txn) {
        return txn.getEmailRisk();
    }
}
