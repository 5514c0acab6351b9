package com.bank.txnrisk.model;

/**
 * Scoring rules. Declaration order is evaluation order, which fixes the order
 * of reasons in the result.
 */
public enum RuleType {
    HIGH_AMOUNT,
    NEW_USER_HIGH_AMOUNT,
    NIGHT_HOUR,
    GEO_MISMATCH,
    LATENCY_EXTREME,
    IP_RISK,
    DEVICE_FINGERPRINT_RISK,
    EMAIL_RISK,
    CHARGEBACK_HISTORY,
    FREQUENCY_BUFFER
}
