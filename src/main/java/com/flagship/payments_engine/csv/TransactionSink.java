package com.flagship.payments_engine.csv;

import com.flagship.payments_engine.transaction.Transaction;

/**
 * Receives parsed transactions. Implementations may block for backpressure.
 */
@FunctionalInterface
public interface TransactionSink {

    void accept(Transaction transaction) throws InterruptedException;
}
