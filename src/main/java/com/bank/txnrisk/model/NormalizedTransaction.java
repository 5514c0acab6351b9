package com.bank.txnrisk.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Fully populated transaction seen by the rules. Numeric fields always hold a
 * value; {@code hour}, {@code productType}, {@code geoState}, {@code deviceType}
 * and the two country codes stay null when the caller did not send them.
 */
@Value
@Builder(toBuilder = true)
public class NormalizedTransaction {

    public static final String NEW_USER = "new";

    long transactionId;
    @Builder.Default
    BigDecimal amountMxn = BigDecimal.ZERO;
    int customerTxn30d;
    String geoState;
    String deviceType;
    int chargebackCount;
    Integer hour;
    String productType;
    long latencyMs;
    @Builder.Default
    String userReputation = NEW_USER;
    @Builder.Default
    String deviceFingerprintRisk = "low";
    @Builder.Default
    String ipRisk = "low";
    @Builder.Default
    String emailRisk = "low";
    String binCountry;
    String ipCountry;

    public boolean isNewUser() {
        return NEW_USER.equals(userReputation);
    }
}
