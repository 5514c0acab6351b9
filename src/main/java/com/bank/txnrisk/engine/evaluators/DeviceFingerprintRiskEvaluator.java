package com.bank.txnrisk.engine.evaluators;

import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class DeviceFingerprintRiskEvaluator extends RiskLevelEvaluator {

    private final ScoringConfig config;

    public DeviceFingerprintRiskEvaluator(ScoringConfig config) {
        super("device_fingerprint_risk");
        this.config = config;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.DEVICE_FINGERPRINT_RISK;
    }

    @Override
    protected Map<String, Integer> weights() {
        return config.getDeviceFingerprintRiskWeights();
    }

    @Override
    protected String levelOf(NormalizedTransaction txn) {
        return txn.getDeviceFingerprintRisk();
    }
}
