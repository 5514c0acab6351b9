package com.bank.txnrisk.engine.evaluators;

import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.engine.RuleEvaluator;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.RuleType;
import com.bank.txnrisk.model.ScoreSignal;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Flags amounts above the configured band for the transaction's product type.
 *
 * Logic: amount > amountThresholds[productType], falling back to the "default"
 * band when the product type is unset or has no band of its own.
 *
 * Reason: {@code high_amount:<product_type>:<amount>(+2)}, amount without trailing zeros.
 */
@Component
public class HighAmountEvaluator implements RuleEvaluator {

    private final ScoringConfig config;

    public HighAmountEvaluator(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.HIGH_AMOUNT;
    }

    @Override
    public Optional<ScoreSignal> evaluate(NormalizedTransaction txn) {
        if (!isHighAmount(config, txn)) {
            return Optional.empty();
        }

        String productLabel = txn.getProductType() != null
                ? txn.getProductType()
                : ScoringConfig.DEFAULT_PRODUCT_TYPE;
        String label = "high_amount:" + productLabel + ":" + formatAmount(txn.getAmountMxn());
        return Optional.of(ScoreSignal.of(RuleType.HIGH_AMOUNT, label, config.getHighAmountWeight()));
    }

    static boolean isHighAmount(ScoringConfig config, NormalizedTransaction txn) {
        BigDecimal threshold = config.amountThresholdFor(txn.getProductType());
        return txn.getAmountMxn().compareTo(threshold) > 0;
    }

    static String formatAmount(BigDecimal amount) {
        return amount.stripTrailingZeros().toPlainString();
    }
}
