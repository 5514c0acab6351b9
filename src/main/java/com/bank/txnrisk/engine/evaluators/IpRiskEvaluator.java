package com.bank.txnrisk.engine.evaluators;

import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class IpRiskEvaluator extends RiskLevelEvaluator {

    private final ScoringConfig config;

    public IpRiskEvaluator(ScoringConfig config) {
        super("ip_risk");
        this.config = config;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.IP_RISK;
    }

    @Override
    protected Map<String, Integer> weights() {
        return config.getIpRiskWeights();
    }

    @Override
    protected String levelOf(NormalizedTransaction txn) {
        return txn.getIpRisk();
    }
}
