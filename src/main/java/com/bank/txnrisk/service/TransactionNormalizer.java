package com.bank.txnrisk.service;

import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.exception.InvalidTransactionException;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.TransactionRequest;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a partially populated request into a {@link NormalizedTransaction}.
 *
 * Missing optional fields get their defaults. Out-of-domain values are
 * rejected with {@link InvalidTransactionException}, never coerced:
 * negative or oversized amounts, negative counters, an hour outside 0-23,
 * or a risk level not configured for that signal. Blank strings count as missing; enum-like
 * strings are lower-cased and country codes upper-cased.
 */
@Component
public class TransactionNormalizer {

    static final int MAX_AMOUNT_INTEGER_DIGITS = 15;
    static final int MAX_AMOUNT_FRACTION_DIGITS = 6;

    private final ScoringConfig config;

    public TransactionNormalizer(ScoringConfig config) {
        this.config = config;
    }

    public NormalizedTransaction normalize(TransactionRequest request) {
        if (request == null || request.getTransactionId() == null) {
            throw new InvalidTransactionException("transaction_id", "transaction_id is required");
        }

        BigDecimal amount = request.getAmountMxn() != null ? request.getAmountMxn() : BigDecimal.ZERO;
        if (amount.signum() < 0) {
            throw new InvalidTransactionException("amount_mxn", "amount_mxn must be >= 0");
        }
        BigDecimal stripped = amount.stripTrailingZeros();
        if (stripped.precision() - stripped.scale() > MAX_AMOUNT_INTEGER_DIGITS
                || stripped.scale() > MAX_AMOUNT_FRACTION_DIGITS) {
            throw new InvalidTransactionException("amount_mxn", "amount_mxn must have at most "
                    + MAX_AMOUNT_INTEGER_DIGITS + " integer and " + MAX_AMOUNT_FRACTION_DIGITS + " decimal digits");
        }

        Integer hour = request.getHour();
        if (hour != null && (hour < 0 || hour > 23)) {
            throw new InvalidTransactionException("hour", "hour must be within 0-23");
        }

        String userReputation = lower(request.getUserReputation());

        return NormalizedTransaction.builder()
                .transactionId(request.getTransactionId())
                .amountMxn(amount)
                .customerTxn30d(nonNegative("customer_txn_30d", request.getCustomerTxn30d()))
                .geoState(trim(request.getGeoState()))
                .deviceType(lower(request.getDeviceType()))
                .chargebackCount(nonNegative("chargeback_count", request.getChargebackCount()))
                .hour(hour)
                .productType(lower(request.getProductType()))
                .latencyMs(nonNegative("latency_ms", request.getLatencyMs()))
                .userReputation(userReputation != null ? userReputation : NormalizedTransaction.NEW_USER)
                .deviceFingerprintRisk(riskLevel("device_fingerprint_risk",
                        request.getDeviceFingerprintRisk(), config.getDeviceFingerprintRiskWeights()))
                .ipRisk(riskLevel("ip_risk", request.getIpRisk(), config.getIpRiskWeights()))
                .emailRisk(riskLevel("email_risk", request.getEmailRisk(), config.getEmailRiskWeights()))
                .binCountry(upper(request.getBinCountry()))
                .ipCountry(upper(request.getIpCountry()))
                .build();
    }

    private static int nonNegative(String field, Integer value) {
        if (value == null) {
            return 0;
        }
        if (value < 0) {
            throw new InvalidTransactionException(field, field + " must be >= 0");
        }
        return value;
    }

    private static long nonNegative(String field, Long value) {
        if (value == null) {
            return 0L;
        }
        if (value < 0) {
            throw new InvalidTransactionException(field, field + " must be >= 0");
        }
        return value;
    }

    private static String riskLevel(String field, String value, Map<String, Integer> levels) {
        String level = lower(value);
        if (level == null) {
            return ScoringConfig.LOW_RISK;
        }
        if (!levels.containsKey(level)) {
            throw new InvalidTransactionException(field,
                    field + " must be one of " + levels.keySet() + ", got '" + value + "'");
        }
        return level;
    }

    private static String trim(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static String lower(String value) {
        String trimmed = trim(value);
        return trimmed != null ? trimmed.toLowerCase(Locale.ROOT) : null;
    }

    private static String upper(String value) {
        String trimmed = trim(value);
        return trimmed != null ? trimmed.toUpperCase(Locale.ROOT) : null;
    }
}
