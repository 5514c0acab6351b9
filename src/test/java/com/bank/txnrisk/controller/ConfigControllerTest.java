package com.bank.txnrisk.controller;

import com.bank.txnrisk.config.MetricsConfig;
import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.engine.RuleEngine;
import com.bank.txnrisk.engine.hardblock.HardBlockPolicy;
import com.bank.txnrisk.model.RuleType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Set;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfigController.class)
class ConfigControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScoringConfig scoringConfig;

    @MockBean
    private RuleEngine ruleEngine;

    @MockBean
    private HardBlockPolicy hardBlockPolicy;

    @MockBean
    private MetricsConfig metricsConfig;

    @BeforeEach
    void setUp() {
        when(scoringConfig.describe()).thenReturn(ScoringConfig.defaults().describe());
        when(ruleEngine.getRegisteredRuleTypes()).thenReturn(List.of(RuleType.HIGH_AMOUNT, RuleType.NIGHT_HOUR));
        when(hardBlockPolicy.getNames()).thenReturn(Set.of("chargebacks_with_high_ip_risk"));
    }

    @Test
    void getConfig_thresholds() throws Exception {
        mockMvc.perform(get("/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score_to_decision[0].min_score").value(10))
                .andExpect(jsonPath("$.score_to_decision[0].decision").value("REJECTED"))
                .andExpect(jsonPath("$.score_to_decision[1].min_score").value(4))
                .andExpect(jsonPath("$.score_to_decision[1].decision").value("IN_REVIEW"))
                .andExpect(jsonPath("$.amount_thresholds.digital").value(2500))
                .andExpect(jsonPath("$.amount_thresholds.default").value(5000));
    }

    @Test
    void getConfig_ruleWeights() throws Exception {
        mockMvc.perform(get("/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rule_weights.night_hour.start").value(22))
                .andExpect(jsonPath("$.rule_weights.night_hour.end").value(6))
                .andExpect(jsonPath("$.rule_weights.geo_mismatch").value(2))
                .andExpect(jsonPath("$.rule_weights.latency_extreme.threshold_ms").value(2500))
                .andExpect(jsonPath("$.rule_weights.ip_risk.high").value(3))
                .andExpect(jsonPath("$.rule_weights.email_risk.new_domain").value(2))
                .andExpect(jsonPath("$.rule_weights.frequency_buffer.delta").value(-1));
    }

    @Test
    void getConfig_activeRulesAndHardBlocks() throws Exception {
        mockMvc.perform(get("/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hard_blocks.enabled").value(true))
                .andExpect(jsonPath("$.hard_blocks.min_chargebacks").value(2))
                .andExpect(jsonPath("$.active_rules[0]").value("high_amount"))
                .andExpect(jsonPath("$.active_rules[1]").value("night_hour"))
                .andExpect(jsonPath("$.active_hard_blocks[0]").value("chargebacks_with_high_ip_risk"));
    }
}
