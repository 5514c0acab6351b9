package com.bank.txnrisk.engine.evaluators;

import com.bank.txnrisk.config.ScoringConfig;
import com.bank.txnrisk.model.NormalizedTransaction;
import com.bank.txnrisk.model.ScoreSignal;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class FrequencyBufferEvaluatorTest {

    private final FrequencyBufferEvaluator evaluator = new FrequencyBufferEvaluator(ScoringConfig.defaults());

    @Test
    void evaluate_recurrentActiveUser_reducesScore() {
        NormalizedTransaction txn = NormalizedTransaction.builder()
                .transactionId(105).userReputation("recurrent").customerTxn30d(5).build();

        Optional<ScoreSignal> signal = evaluator.evaluate(txn);

        assertThat(signal).isPresent();
        assertThat(signal.get().getReason()).isEqualTo("frequency_buffer(-1)");
        assertThat(signal.get().getDelta()).isEqualTo(-1);
    }

    @Test
    void evaluate_exactlyAtFloor_triggered() {
        NormalizedTransaction txn = NormalizedTransaction.builder()
                .transactionId(1).userReputation("recurrent").customerTxn30d(3).build();

        assertThat(evaluator.evaluate(txn)).isPresent();
    }

    @Test
    void evaluate_belowFloor_notTriggered() {
        NormalizedTransaction txn = NormalizedTransaction.builder()
                .transactionId(1).userReputation("recurrent").customerTxn30d(2).build();

        assertThat(evaluator.evaluate(txn)).isEmpty();
    }

    @Test
    void evaluate_newUser_notTriggered() {
        NormalizedTransaction txn = NormalizedTransaction.builder()
                .transactionId(1).userReputation("new").customerTxn30d(50).build();

        assertThat(evaluator.evaluate(txn)).isEmpty();
    }
}
