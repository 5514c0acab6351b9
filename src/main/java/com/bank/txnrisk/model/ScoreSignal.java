package com.bank.txnrisk.model;

import lombok.Value;

import java.util.Locale;

/**
 * A triggered rule's contribution: an audit reason and a signed score delta.
 * The reason always ends with the delta, e.g. {@code geo_mismatch:US!=MX(+2)}.
 */
@Value
public class ScoreSignal {

    RuleType ruleType;
    String reason;
    int delta;

    public static ScoreSignal of(RuleType ruleType, String label, int delta) {
        return new ScoreSignal(ruleType, String.format(Locale.ROOT, "%s(%+d)", label, delta), delta);
    }
}
