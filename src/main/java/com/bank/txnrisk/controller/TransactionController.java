package com.bank.txnrisk.controller;

import com.bank.txnrisk.model.EvaluationResult;
import com.bank.txnrisk.model.TransactionRequest;
import com.bank.txnrisk.service.TransactionEvaluationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Transactions", description = "Submit transactions for risk evaluation")
public class TransactionController {

    private final TransactionEvaluationService evaluationService;

    public TransactionController(TransactionEvaluationService evaluationService) {
        this.evaluationService = evaluationService;
    }

    @Operation(summary = "Evaluate a transaction",
            description = "Scores the transaction against every rule and returns the risk score, " +
                    "the decision (ACCEPTED / IN_REVIEW / REJECTED) and the ordered reasons. " +
                    "Only transaction_id is required; other fields default when absent.")
    @PostMapping("/transaction")
    public ResponseEntity<EvaluationResult> evaluateTransaction(@RequestBody TransactionRequest request) {
        return ResponseEntity.ok(evaluationService.evaluate(request));
    }
}
