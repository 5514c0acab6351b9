package com.bank.txnrisk.exception;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned for every failed request.
 */
public record ErrorResponse(
    int status,
    String message,
    Map<String, String> errors,
    Instant timestamp
) {}
