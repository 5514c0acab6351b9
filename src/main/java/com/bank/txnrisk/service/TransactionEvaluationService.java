package com.bank.txnrisk.service;

import com.bank.txnrisk.config.MetricsConfig;
import com.bank.txnrisk.engine.RuleEngine;
import com.bank.txnrisk.engine.hardblock.HardBlockPolicy;
import com.bank.txnrisk.model.Decision;
import com.bank.txnrisk.model.EvaluationResult;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.ScoreSignal;
import com.bank.txnrisk.model.TransactionRequest;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Main orchestrator for transaction evaluation.
 *
 * Flow:
 * 1. Normalize the request (defaults, validation)
 * 2. Run all rules via the RuleEngine
 * 3. Check hard blocks
 * 4. Aggregate score and decision via RiskScoringService
 * 5. Record metrics and return the result
 *
 * Stateless: safe to call from any number of request threads.
 */
@Service
public class TransactionEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(TransactionEvaluationService.class);

    private final TransactionNormalizer normalizer;
    private final RuleEngine ruleEngine;
    private final HardBlockPolicy hardBlockPolicy;
    private final RiskScoringService riskScoringService;
    private final MetricsConfig metricsConfig;

    public TransactionEvaluationService(TransactionNormalizer normalizer,
                                        RuleEngine ruleEngine,
                                        HardBlockPolicy hardBlockPolicy,
                                        RiskScoringService riskScoringService,
                                        MetricsConfig metricsConfig) {
        this.normalizer = normalizer;
        this.ruleEngine = ruleEngine;
        this.hardBlockPolicy = hardBlockPolicy;
        this.riskScoringService = riskScoringService;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Evaluate a transaction.
     * This is the main entry point called by the REST controller.
     *
     * @throws com.bank.txnrisk.exception.InvalidTransactionException if the request cannot be scored
     */
    @Observed(name = "transaction.evaluate", contextualName = "evaluate-transaction")
    public EvaluationResult evaluate(TransactionRequest request) {
        NormalizedTransaction txn = normalizer.normalize(request);

        List<ScoreSignal> signals = ruleEngine.evaluateAll(txn);
        List<String> hardBlocks = hardBlockPolicy.evaluate(txn);

        EvaluationResult result = riskScoringService.computeResult(txn, signals, hardBlocks);

        metricsConfig.recordEvaluation(result.getDecision().name(), result.getRiskScore());

        if (result.getDecision().isMoreSevereThan(Decision.ACCEPTED)) {
            log.warn("Transaction {} flagged: decision={}, score={}, reasons={}",
                    txn.getTransactionId(), result.getDecision(), result.getRiskScore(), result.getReasons());
        } else {
            log.debug("Transaction {} accepted: score={}, reasons={}",
                    txn.getTransactionId(), result.getRiskScore(), result.getReasons());
        }

        return result;
    }
}
