package com.flagship.payments_engine.account;

import com.flagship.payments_engine.money.Money;
import com.flagship.payments_engine.transaction.TransactionType;
import lombok.Value;

/**
 * A settled deposit or withdrawal kept in an account's ledger.
 * Only transactions that actually moved funds are recorded, so the
 * ledger is the source of truth for dispute amounts.
 */
@Value
public class LedgerRecord {
    TransactionType type;
    Money amount;

    public boolean isDeposit() {
        return type == TransactionType.DEPOSIT;
    }
}
