package com.bank.txnrisk.service;

import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.model.Decision;
import com.bank.txnrisk.model.EvaluationResult;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.ScoreSignal;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregates rule signals into the final result.
 *
 * risk_score = Σ(delta), not clamped: a dominant frequency buffer can push it
 * below zero, and the reasons always add up to the reported score.
 * Any hard block forces REJECTED; otherwise the score-to-decision thresholds
 * decide (highest first, ACCEPTED when none is reached).
 */
@Service
public class RiskScoringService {

    static final String HARD_BLOCK_PREFIX = "hard_block:";

    private final ScoringConfig config;

    public RiskScoringService(ScoringConfig config) {
        this.config = config;
    }

    public EvaluationResult computeResult(NormalizedTransaction txn, List<ScoreSignal> signals,
                                          List<String> hardBlocks) {
        int riskScore = 0;
        List<String> reasons = new ArrayList<>(signals.size() + hardBlocks.size());
        for (ScoreSignal signal : signals) {
            riskScore += signal.getDelta();
            reasons.add(signal.getReason());
        }
        for (String hardBlock : hardBlocks) {
            reasons.add(HARD_BLOCK_PREFIX + hardBlock);
        }

        Decision decision = hardBlocks.isEmpty()
                ? config.decisionFor(riskScore)
                : Decision.REJECTED;

        return EvaluationResult.builder()
                .transactionId(txn.getTransactionId())
                .riskScore(riskScore)
                .decision(decision)
                .reasons(List.copyOf(reasons))
                .hardBlocks(List.copyOf(hardBlocks))
                .build();
    }
}
