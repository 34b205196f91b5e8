package com.flagship.payments_engine.engine;

import com.flagship.payments_engine.account.AccountsSnapshot;
import com.flagship.payments_engine.account.ClientAccount;
import com.flagship.payments_engine.account.Outcome;
import com.flagship.payments_engine.transaction.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Routes transactions to client accounts and enforces global
 * transaction-ID uniqueness.
 *
 * Deposits and withdrawals pass a duplicate gate before reaching an account:
 * the first occurrence of an ID wins, whichever client it names, and a
 * duplicate never creates an account. Disputes, resolves and chargebacks
 * are only routed to accounts that already exist.
 *
 * Accounts are kept in a TreeMap so the snapshot comes out ordered by client ID.
 *
 * Not thread-safe: owned by the single consumer of {@link PaymentsEngine}.
 */
@Slf4j
public class TransactionAggregator {

    private final Map<Integer, ClientAccount> accounts = new TreeMap<>();
    private final Set<Long> processedTransactionIds = new HashSet<>();

    /**
     * Applies one transaction.
     *
     * @return APPLIED, or the reason the transaction was discarded
     */
    public Outcome apply(Transaction tx) {
        if (tx.isDisputeRelated()) {
            ClientAccount account = accounts.get(tx.getClientId());
            if (account == null) {
                log.warn("Discarding {} for client without account: {}", tx.getType(), tx);
                return Outcome.UNKNOWN_CLIENT;
            }
            return account.adjudicate(tx);
        }

        if (!processedTransactionIds.add(tx.getTransactionId())) {
            log.warn("Discarding duplicate transaction ID {}: {}", tx.getTransactionId(), tx);
            return Outcome.DUPLICATE_TRANSACTION;
        }

        return accounts
            .computeIfAbsent(tx.getClientId(), ClientAccount::new)
            .settle(tx);
    }

    public Optional<ClientAccount> findAccount(int clientId) {
        return Optional.ofNullable(accounts.get(clientId));
    }

    public int accountCount() {
        return accounts.size();
    }

    public boolean hasProcessed(long transactionId) {
        return processedTransactionIds.contains(transactionId);
    }

    /**
     * Final state of every account created so far, ascending client ID.
     */
    public AccountsSnapshot snapshot() {
        return AccountsSnapshot.of(
            accounts.values().stream()
                .map(ClientAccount::snapshot)
                .toList()
        );
    }
}
