package com.bank.txnrisk.config;

import com.bank.txnrisk.exception.ScoringConfigurationException;
import com.bank.txnrisk.model.Decision;
import com.bank.txnrisk.model.ScoreThreshold;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable scoring configuration shared by every evaluator, the hard-block
 * policy and the aggregator. Built once from {@link RiskScoringProperties};
 * invalid settings fail with {@link ScoringConfigurationException}.
 */
@Value
@Builder(access = AccessLevel.PRIVATE)
public class ScoringConfig {

    public static final String DEFAULT_PRODUCT_TYPE = "default";
    public static final String LOW_RISK = "low";

    // Highest threshold first
    List<ScoreThreshold> scoreToDecision;
    Map<String, BigDecimal> amountThresholds;

    int nightHourStart;
    int nightHourEnd;
    int nightHourWeight;
    int geoMismatchWeight;
    long latencyExtremeMs;
    int latencyExtremeWeight;
    int highAmountWeight;
    int newUserHighAmountWeight;
    int minChargebacks;
    int chargebackHistoryWeight;
    String frequencyBufferReputation;
    int frequencyBufferMinTxn30d;
    int frequencyBufferWeight;
    Map<String, Integer> ipRiskWeights;
    Map<String, Integer> deviceFingerprintRiskWeights;
    Map<String, Integer> emailRiskWeights;

    boolean hardBlockEnabled;
    int hardBlockMinChargebacks;
    Set<String> hardBlockIpRiskLevels;

    public static ScoringConfig defaults() {
        return from(new RiskScoringProperties());
    }

    public static ScoringConfig from(RiskScoringProperties props) {
        RiskScoringProperties.Weights w = props.getWeights();
        RiskScoringProperties.HardBlock hb = props.getHardBlock();

        if (props.getReviewAt() < 0) {
            throw new ScoringConfigurationException("risk.review-at", "must be >= 0");
        }
        if (props.getReviewAt() >= props.getRejectAt()) {
            throw new ScoringConfigurationException("risk.review-at", "must be less than risk.reject-at");
        }
        checkHour("risk.weights.night-hour-start", w.getNightHourStart());
        checkHour("risk.weights.night-hour-end", w.getNightHourEnd());
        if (w.getLatencyExtremeMs() <= 0) {
            throw new ScoringConfigurationException("risk.weights.latency-extreme-ms", "must be > 0");
        }
        checkNonNegative("risk.weights.night-hour", w.getNightHour());
        checkNonNegative("risk.weights.geo-mismatch", w.getGeoMismatch());
        checkNonNegative("risk.weights.latency-extreme", w.getLatencyExtreme());
        checkNonNegative("risk.weights.high-amount", w.getHighAmount());
        checkNonNegative("risk.weights.new-user-high-amount", w.getNewUserHighAmount());
        checkNonNegative("risk.weights.chargeback-history", w.getChargebackHistory());
        if (w.getMinChargebacks() < 1) {
            throw new ScoringConfigurationException("risk.weights.min-chargebacks", "must be >= 1");
        }
        if (w.getFrequencyBuffer() > 0) {
            throw new ScoringConfigurationException("risk.weights.frequency-buffer", "must be <= 0");
        }
        if (w.getFrequencyBufferMinTxn30d() < 0) {
            throw new ScoringConfigurationException("risk.weights.frequency-buffer-min-txn30d", "must be >= 0");
        }
        if (isBlank(w.getFrequencyBufferReputation())) {
            throw new ScoringConfigurationException("risk.weights.frequency-buffer-reputation", "must not be blank");
        }
        if (hb.getMinChargebacks() < 0) {
            throw new ScoringConfigurationException("risk.hard-block.min-chargebacks", "must be >= 0");
        }

        Map<String, Integer> ipRisk = riskWeights("risk.weights.ip-risk", w.getIpRisk());
        Set<String> hardBlockIpLevels = new LinkedHashSet<>();
        if (hb.getIpRiskLevels() != null) {
            for (String level : hb.getIpRiskLevels()) {
                String key = normalizeKey(level);
                if (!ipRisk.containsKey(key)) {
                    throw new ScoringConfigurationException("risk.hard-block.ip-risk-levels",
                            "unknown ip risk level '" + level + "'");
                }
                hardBlockIpLevels.add(key);
            }
        }

        return ScoringConfig.builder()
                .scoreToDecision(List.of(
                        new ScoreThreshold(props.getRejectAt(), Decision.REJECTED),
                        new ScoreThreshold(props.getReviewAt(), Decision.IN_REVIEW)))
                .amountThresholds(amountThresholds(props.getAmountThresholds()))
                .nightHourStart(w.getNightHourStart())
                .nightHourEnd(w.getNightHourEnd())
                .nightHourWeight(w.getNightHour())
                .geoMismatchWeight(w.getGeoMismatch())
                .latencyExtremeMs(w.getLatencyExtremeMs())
                .latencyExtremeWeight(w.getLatencyExtreme())
                .highAmountWeight(w.getHighAmount())
                .newUserHighAmountWeight(w.getNewUserHighAmount())
                .minChargebacks(w.getMinChargebacks())
                .chargebackHistoryWeight(w.getChargebackHistory())
                .frequencyBufferReputation(normalizeKey(w.getFrequencyBufferReputation()))
                .frequencyBufferMinTxn30d(w.getFrequencyBufferMinTxn30d())
                .frequencyBufferWeight(w.getFrequencyBuffer())
                .ipRiskWeights(ipRisk)
                .deviceFingerprintRiskWeights(riskWeights("risk.weights.device-fingerprint-risk",
                        w.getDeviceFingerprintRisk()))
                .emailRiskWeights(riskWeights("risk.weights.email-risk", w.getEmailRisk()))
                .hardBlockEnabled(hb.isEnabled())
                .hardBlockMinChargebacks(hb.getMinChargebacks())
                .hardBlockIpRiskLevels(Set.copyOf(hardBlockIpLevels))
                .build();
    }

    /**
     * Walks the thresholds from the highest down; the first one the score
     * reaches decides. Scores below every threshold are accepted.
     */
    public Decision decisionFor(int score) {
        for (ScoreThreshold threshold : scoreToDecision) {
            if (score >= threshold.getMinScore()) {
                return threshold.getDecision();
            }
        }
        return Decision.ACCEPTED;
    }

    public String amountBandFor(String productType) {
        return productType != null && amountThresholds.containsKey(productType)
                ? productType
                : DEFAULT_PRODUCT_TYPE;
    }

    public BigDecimal amountThresholdFor(String productType) {
        return amountThresholds.get(amountBandFor(productType));
    }

    /** Night window is [start, end); wraps past midnight when start > end. */
    public boolean isNightHour(int hour) {
        if (nightHourStart == nightHourEnd) {
            return false;
        }
        if (nightHourStart < nightHourEnd) {
            return hour >= nightHourStart && hour < nightHourEnd;
        }
        return hour >= nightHourStart || hour < nightHourEnd;
    }

    /**
     * Serializable view for the configuration endpoint.
     */
    public Map<String, Object> describe() {
        Map<String, Object> weights = new LinkedHashMap<>();
        weights.put("night_hour", ordered(
                "start", nightHourStart, "end", nightHourEnd, "delta", nightHourWeight));
        weights.put("geo_mismatch", geoMismatchWeight);
        weights.put("latency_extreme", ordered(
                "threshold_ms", latencyExtremeMs, "delta", latencyExtremeWeight));
        weights.put("high_amount", highAmountWeight);
        weights.put("new_user_high_amount", newUserHighAmountWeight);
        weights.put("chargeback_history", ordered(
                "min_chargebacks", minChargebacks, "delta", chargebackHistoryWeight));
        weights.put("frequency_buffer", ordered(
                "user_reputation", frequencyBufferReputation,
                "min_customer_txn_30d", frequencyBufferMinTxn30d,
                "delta", frequencyBufferWeight));
        weights.put("ip_risk", ipRiskWeights);
        weights.put("device_fingerprint_risk", deviceFingerprintRiskWeights);
        weights.put("email_risk", emailRiskWeights);

        Map<String, Object> hardBlocks = new LinkedHashMap<>();
        hardBlocks.put("enabled", hardBlockEnabled);
        hardBlocks.put("min_chargebacks", hardBlockMinChargebacks);
        hardBlocks.put("ip_risk_levels", hardBlockIpRiskLevels.stream().sorted().toList());

        Map<String, Object> view = new LinkedHashMap<>();
        view.put("score_to_decision", scoreToDecision);
        view.put("amount_thresholds", amountThresholds);
        view.put("rule_weights", weights);
        view.put("hard_blocks", hardBlocks);
        return view;
    }

    private static Map<String, BigDecimal> amountThresholds(Map<String, BigDecimal> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new ScoringConfigurationException("risk.amount-thresholds", "must not be empty");
        }
        Map<String, BigDecimal> thresholds = new LinkedHashMap<>();
        raw.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(Comparator.naturalOrder()))
                .forEach(e -> {
                    if (e.getValue() == null || e.getValue().signum() < 0) {
                        throw new ScoringConfigurationException("risk.amount-thresholds." + e.getKey(),
                                "must be >= 0");
                    }
                    thresholds.put(normalizeKey(e.getKey()), e.getValue());
                });
        if (!thresholds.containsKey(DEFAULT_PRODUCT_TYPE)) {
            throw new ScoringConfigurationException("risk.amount-thresholds",
                    "missing '" + DEFAULT_PRODUCT_TYPE + "' band");
        }
        return Collections.unmodifiableMap(thresholds);
    }

    private static Map<String, Integer> riskWeights(String property, Map<String, Integer> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new ScoringConfigurationException(property, "must not be empty");
        }
        Map<String, Integer> weights = new LinkedHashMap<>();
        raw.forEach((level, weight) -> {
            if (weight == null || weight < 0) {
                throw new ScoringConfigurationException(property + "." + level, "must be >= 0");
            }
            weights.put(normalizeKey(level), weight);
        });
        if (!weights.containsKey(LOW_RISK)) {
            throw new ScoringConfigurationException(property, "missing '" + LOW_RISK + "' level");
        }
        return Collections.unmodifiableMap(weights);
    }

    private static Map<String, Object> ordered(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    private static void checkHour(String property, int hour) {
        if (hour < 0 || hour > 23) {
            throw new ScoringConfigurationException(property, "must be within 0-23");
        }
    }

    private static void checkNonNegative(String property, int weight) {
        if (weight < 0) {
            throw new ScoringConfigurationException(property, "must be >= 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static String normalizeKey(String key) {
        return key == null ? null : key.trim().toLowerCase(Locale.ROOT);
    }
}
