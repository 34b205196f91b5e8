package com.flagship.payments_engine.account;

/**
 * What happened to a single transaction.
 *
 * Every value except APPLIED is a discard: the transaction left no trace
 * on any balance. Outcomes are advisory, they feed logs and metrics.
 */
public enum Outcome {
    APPLIED,

    // settlement
    ACCOUNT_LOCKED,
    MISSING_AMOUNT,
    NEGATIVE_AMOUNT,
    INSUFFICIENT_FUNDS,

    // adjudication
    UNKNOWN_TRANSACTION,
    ALREADY_DISPUTED,
    NOT_DISPUTABLE,
    NOT_DISPUTED,

    // routing
    UNKNOWN_CLIENT,
    DUPLICATE_TRANSACTION;

    public boolean isApplied() {
        return this == APPLIED;
    }
}
