package com.flagship.payments_engine.transaction;

import java.util.Locale;

/**
 * Kind of operation a transaction requests.
 *
 * DEPOSIT and WITHDRAWAL move funds and are settled against an account.
 * DISPUTE, RESOLVE and CHARGEBACK reference an earlier settled transaction
 * and are adjudicated instead.
 */
public enum TransactionType {
    DEPOSIT,
    WITHDRAWAL,
    DISPUTE,
    RESOLVE,
    CHARGEBACK;

    /**
     * True for DISPUTE, RESOLVE and CHARGEBACK.
     */
    public boolean isDisputeRelated() {
        return this == DISPUTE || this == RESOLVE || this == CHARGEBACK;
    }

    /**
     * Parses the textual form used in input files. Case-insensitive,
     * surrounding whitespace ignored.
     *
     * @throws IllegalArgumentException if the text names no known type
     */
    public static TransactionType fromText(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Transaction type is missing");
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (TransactionType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + text.trim());
    }

    public String toText() {
        return name().toLowerCase(Locale.ROOT);
    }
}
