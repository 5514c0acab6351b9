package com.bank.txnrisk.engine.evaluators;

import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.engine.RuleEvaluator;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.RuleType;
import com.bank.txnrisk.model.ScoreSignal;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Detects a card issued in one country being used from an IP in another.
 *
 * Only fires when both countries are known; a missing country is not a mismatch.
 */
@Component
public class GeoMismatchEvaluator implements RuleEvaluator {

    private final ScoringConfig config;

    public GeoMismatchEvaluator(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.GEO_MISMATCH;
    }

    @Override
    public Optional<ScoreSignal> evaluate(NormalizedTransaction txn) {
        String bin = txn.getBinCountry();
        String ip = txn.getIpCountry();
        if (bin == null || ip == null || bin.equals(ip)) {
            return Optional.empty();
        }
        return Optional.of(ScoreSignal.of(RuleType.GEO_MISMATCH,
                "geo_mismatch:" + bin + "!=" + ip, config.getGeoMismatchWeight()));
    }
}
