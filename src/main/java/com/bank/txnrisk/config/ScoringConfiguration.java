package com.bank.txnrisk.config;

import com.bank.txnrisk.model.ScoreThreshold;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RiskScoringProperties.class)
public class ScoringConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ScoringConfiguration.class);

    /**
     * Freezes the bound properties into the configuration used for every
     * evaluation. Invalid settings abort startup.
     */
    @Bean
    public ScoringConfig scoringConfig(RiskScoringProperties properties) {
        ScoringConfig config = ScoringConfig.from(properties);
        for (ScoreThreshold threshold : config.getScoreToDecision()) {
            log.info("Score threshold: >= {} -> {}", threshold.getMinScore(), threshold.getDecision());
        }
        log.info("Amount thresholds: {}", config.getAmountThresholds());
        return config;
    }
}
