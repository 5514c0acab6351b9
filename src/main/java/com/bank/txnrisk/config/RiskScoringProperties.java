package com.bank.txnrisk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw scoring settings bound from {@code risk.*} in application.yml (or the
 * environment). Only read once, at startup, to build the immutable {@link ScoringConfig}.
 */
@Data
@ConfigurationProperties(prefix = "risk")
public class RiskScoringProperties {

    // Score at or above which the transaction is rejected
    private int rejectAt = 10;

    // Score at or above which the transaction goes to manual review
    private int reviewAt = 4;

    // Amount bands per product type. "default" applies to unset / unlisted product types.
    private Map<String, BigDecimal> amountThresholds = defaultAmountThresholds();

    private Weights weights = new Weights();

    private HardBlock hardBlock = new HardBlock();

    @Data
    public static class Weights {
        private int nightHourStart = 22;
        private int nightHourEnd = 6;
        private int nightHour = 1;
        private int geoMismatch = 2;
        private long latencyExtremeMs = 2500;
        private int latencyExtreme = 2;
        private int highAmount = 2;
        private int newUserHighAmount = 2;
        private int minChargebacks = 1;
        private int chargebackHistory = 2;
        private String frequencyBufferReputation = "recurrent";
        private int frequencyBufferMinTxn30d = 3;
        private int frequencyBuffer = -1;
        private Map<String, Integer> ipRisk = riskLevels("medium", 1, "high", 3);
        private Map<String, Integer> deviceFingerprintRisk = riskLevels("medium", 1, "high", 3);
        private Map<String, Integer> emailRisk = riskLevels("new_domain", 2, "high", 3);
    }

    @Data
    public static class HardBlock {
        private boolean enabled = true;
        private int minChargebacks = 2;
        private List<String> ipRiskLevels = new ArrayList<>(List.of("high"));
    }

    private static Map<String, BigDecimal> defaultAmountThresholds() {
        Map<String, BigDecimal> thresholds = new LinkedHashMap<>();
        thresholds.put("digital", new BigDecimal("2500"));
        thresholds.put("physical", new BigDecimal("8000"));
        thresholds.put("subscription", new BigDecimal("1500"));
        thresholds.put(ScoringConfig.DEFAULT_PRODUCT_TYPE, new BigDecimal("5000"));
        return thresholds;
    }

    private static Map<String, Integer> riskLevels(String midLevel, int midWeight, String highLevel, int highWeight) {
        Map<String, Integer> levels = new LinkedHashMap<>();
        levels.put(ScoringConfig.LOW_RISK, 0);
        levels.put(midLevel, midWeight);
        levels.put(highLevel, highWeight);
        return levels;
    }
}
