package com.bank.txnrisk.engine.hardblock;

import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.model.NormalizedTransaction;
import org.springframework.stereotype.Component;

/**
 * Repeat chargebacks combined with a high-risk IP: chargeback_count >= 2 and
 * ip_risk in the configured levels (default: high).
 */
@Component
public class ChargebackIpRiskHardBlock implements HardBlockRule {

    public static final String NAME = "chargebacks_with_high_ip_risk";

    private final ScoringConfig config;

    public ChargebackIpRiskHardBlock(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean matches(NormalizedTransaction txn) {
        return config.isHardBlockEnabled()
                && txn.getChargebackCount() >= config.getHardBlockMinChargebacks()
                && config.getHardBlockIpRiskLevels().contains(txn.getIpRisk());
    }
}
