package com.flagship.payments_engine.transaction;

import com.flagship.payments_engine.money.Money;
import lombok.Value;

import java.util.Objects;
import java.util.Optional;

/**
 * One requested operation, as read from the input stream.
 *
 * Transaction IDs are unsigned 32-bit values unique across all clients;
 * client IDs are unsigned 16-bit values that partition accounts.
 * The amount is only meaningful for deposits and withdrawals.
 */
@Value
public class Transaction {

    public static final long MAX_TRANSACTION_ID = 0xFFFF_FFFFL;
    public static final int MAX_CLIENT_ID = 0xFFFF;

    TransactionType type;
    long transactionId;
    int clientId;
    Money amount;

    public Transaction(TransactionType type, long transactionId, int clientId, Money amount) {
        this.type = Objects.requireNonNull(type, "type");
        if (transactionId < 0 || transactionId > MAX_TRANSACTION_ID) {
            throw new IllegalArgumentException("Transaction ID out of range: " + transactionId);
        }
        if (clientId < 0 || clientId > MAX_CLIENT_ID) {
            throw new IllegalArgumentException("Client ID out of range: " + clientId);
        }
        this.transactionId = transactionId;
        this.clientId = clientId;
        this.amount = amount;
    }

    public static Transaction deposit(int clientId, long transactionId, Money amount) {
        return new Transaction(TransactionType.DEPOSIT, transactionId, clientId, amount);
    }

    public static Transaction withdrawal(int clientId, long transactionId, Money amount) {
        return new Transaction(TransactionType.WITHDRAWAL, transactionId, clientId, amount);
    }

    public static Transaction dispute(int clientId, long transactionId) {
        return new Transaction(TransactionType.DISPUTE, transactionId, clientId, null);
    }

    public static Transaction resolve(int clientId, long transactionId) {
        return new Transaction(TransactionType.RESOLVE, transactionId, clientId, null);
    }

    public static Transaction chargeback(int clientId, long transactionId) {
        return new Transaction(TransactionType.CHARGEBACK, transactionId, clientId, null);
    }

    public Optional<Money> findAmount() {
        return Optional.ofNullable(amount);
    }

    public boolean isDisputeRelated() {
        return type.isDisputeRelated();
    }
}
