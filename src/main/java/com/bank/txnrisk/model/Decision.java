package com.bank.txnrisk.model;

/**
 * Decision tiers, declared in increasing order of severity.
 */
public enum Decision {
    ACCEPTED,
    IN_REVIEW,
    REJECTED;

    public boolean isMoreSevereThan(Decision other) {
        return compareTo(other) > 0;
    }
}
