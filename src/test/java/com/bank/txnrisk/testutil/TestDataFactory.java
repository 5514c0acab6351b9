package com.bank.txnrisk.testutil;

import com.bank.txnrisk.config.MetricsConfig;
import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.engine.RuleEngine;
import com.bank.txnrisk.engine.RuleEvaluator;
import com.bank.txnrisk.engine.evaluators.ChargebackHistoryEvaluator;
import com.bank.txnrisk.engine.evaluators.DeviceFingerprintRiskEvaluator;
import com.bank.txnrisk.engine.evaluators.EmailRiskEvaluator;
import com.bank.txnrisk.engine.evaluators.FrequencyBufferEvaluator;
import com.bank.txnrisk.engine.evaluators.GeoMismatchEvaluator;
import com.bank.txnrisk.engine.evaluators.HighAmountEvaluator;
import com.bank.txnrisk.engine.evaluators.IpRiskEvaluator;
import com.bank.txnrisk.engine.evaluators.LatencyExtremeEvaluator;
import com.bank.txnrisk.engine.evaluators.NewUserHighAmountEvaluator;
import com.bank.txnrisk.engine.evaluators.NightHourEvaluator;
import com.bank.txnrisk.engine.hardblock.ChargebackIpRiskHardBlock;
import com.bank.txnrisk.engine.hardblock.HardBlockPolicy;
import com.bank.txnrisk.model.Decision;
import com.bank.txnrisk.model.EvaluationResult;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.service.RiskScoringService;
import com.bank.txnrisk.service.TransactionEvaluationService;
import com.bank.txnrisk.service.TransactionNormalizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigDecimal;
import java.util.List;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    private TestDataFactory() {}

    /** Transaction with every optional field at its default. */
    public static NormalizedTransaction defaultTransaction(long transactionId) {
        return NormalizedTransaction.builder()
                .transactionId(transactionId)
                .build();
    }

    public static NormalizedTransaction transactionWithAmount(long transactionId, String productType,
                                                              String amount, String reputation) {
        return NormalizedTransaction.builder()
                .transactionId(transactionId)
                .productType(productType)
                .amountMxn(new BigDecimal(amount))
                .userReputation(reputation)
                .build();
    }

    /** Every production evaluator, in no particular order. */
    public static List<RuleEvaluator> allEvaluators(ScoringConfig config) {
        return List.of(
                new FrequencyBufferEvaluator(config),
                new ChargebackHistoryEvaluator(config),
                new EmailRiskEvaluator(config),
                new DeviceFingerprintRiskEvaluator(config),
                new IpRiskEvaluator(config),
                new LatencyExtremeEvaluator(config),
                new GeoMismatchEvaluator(config),
                new NightHourEvaluator(config),
                new NewUserHighAmountEvaluator(config),
                new HighAmountEvaluator(config));
    }

    public static MetricsConfig metrics() {
        return new MetricsConfig(new SimpleMeterRegistry());
    }

    /** The full evaluation pipeline wired by hand, without a Spring context. */
    public static TransactionEvaluationService evaluationService(ScoringConfig config) {
        MetricsConfig metrics = metrics();
        return new TransactionEvaluationService(
                new TransactionNormalizer(config),
                new RuleEngine(allEvaluators(config), metrics),
                new HardBlockPolicy(List.of(new ChargebackIpRiskHardBlock(config)), metrics),
                new RiskScoringService(config),
                metrics);
    }

    public static EvaluationResult createEvaluationResult(long transactionId, int score, Decision decision,
                                                          List<String> reasons) {
        return EvaluationResult.builder()
                .transactionId(transactionId)
                .riskScore(score)
                .decision(decision)
                .reasons(reasons)
                .hardBlocks(List.of())
                .build();
    }
}
