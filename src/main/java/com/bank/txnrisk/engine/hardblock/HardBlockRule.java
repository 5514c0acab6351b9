package com.bank.txnrisk.engine.hardblock;

import com.bank.txnrisk.model.NormalizedTransaction;

/**
 * A predicate that rejects a transaction outright, whatever its score.
 * Register a new hard block by exposing another implementation as a bean.
 */
public interface HardBlockRule {

    /**
     * Stable name, reported in the result as {@code hard_block:<name>}.
     */
    String getName();

    boolean matches(NormalizedTransaction txn);
}
