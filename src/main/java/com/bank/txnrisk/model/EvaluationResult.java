package com.bank.txnrisk.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Risk decision for a single transaction")
public class EvaluationResult {

    @JsonProperty("transaction_id")
    @Schema(description = "Transaction ID that was evaluated", example = "42")
    private long transactionId;

    @JsonProperty("risk_score")
    @Schema(description = "Sum of all rule deltas. Not clamped, can be negative", example = "8")
    private int riskScore;

    @JsonProperty("decision")
    @Schema(description = "ACCEPTED (< review-at), IN_REVIEW, REJECTED (>= reject-at or hard block)",
            example = "IN_REVIEW")
    private Decision decision;

    @JsonProperty("reasons")
    @Schema(description = "Triggered rule reasons in evaluation order, followed by hard blocks",
            example = "[\"high_amount:digital:5200(+2)\", \"new_user_high_amount(+2)\", \"night_hour:23(+1)\"]")
    private List<String> reasons;

    @JsonProperty("hard_blocks")
    @Schema(description = "Names of hard-block rules that forced a rejection", example = "[]")
    private List<String> hardBlocks;
}
