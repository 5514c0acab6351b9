package com.bank.txnrisk.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

@Value
@Schema(description = "Minimum cumulative score that maps to a decision tier")
public class ScoreThreshold {

    @JsonProperty("min_score")
    @Schema(description = "Score at or above which the decision applies", example = "10")
    int minScore;

    @JsonProperty("decision")
    @Schema(description = "Decision tier", example = "REJECTED")
    Decision decision;
}
