package com.bank.txnrisk.controller;

import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.engine.RuleEngine;
import com.bank.txnrisk.engine.hardblock.HardBlockPolicy;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@Tag(name = "Config", description = "Read-only view of the active scoring configuration")
public class ConfigController {

    private final ScoringConfig scoringConfig;
    private final RuleEngine ruleEngine;
    private final HardBlockPolicy hardBlockPolicy;

    public ConfigController(ScoringConfig scoringConfig, RuleEngine ruleEngine, HardBlockPolicy hardBlockPolicy) {
        this.scoringConfig = scoringConfig;
        this.ruleEngine = ruleEngine;
        this.hardBlockPolicy = hardBlockPolicy;
    }

    @Operation(summary = "Get active thresholds and weights",
            description = "Fixed at startup; change application.yml or the environment and restart to tune.")
    @GetMapping("/config")
    public ResponseEntity<Map<String, Object>> getConfig() {
        Map<String, Object> body = new LinkedHashMap<>(scoringConfig.describe());
        body.put("active_rules", ruleEngine.getRegisteredRuleTypes().stream()
                .map(type -> type.name().toLowerCase(Locale.ROOT))
                .toList());
        body.put("active_hard_blocks", List.copyOf(hardBlockPolicy.getNames()));
        return ResponseEntity.ok(body);
    }
}
