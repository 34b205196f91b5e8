package com.flagship.payments_engine.account;

import com.flagship.payments_engine.money.Money;
import com.flagship.payments_engine.transaction.Transaction;
import com.flagship.payments_engine.transaction.TransactionType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Balances, ledger and dispute states of a single client.
 *
 * Key invariant: {@code total == available + held} after every call.
 * Available and total may become negative when a deposit is disputed
 * or charged back after its funds were withdrawn.
 *
 * State changes only through {@link #settle(Transaction)} and
 * {@link #adjudicate(Transaction)}. A rejected transaction is logged and
 * leaves the account untouched; neither method throws for policy violations.
 *
 * Not thread-safe: an account is owned by a single consumer.
 */
@Slf4j
public class ClientAccount {

    @Getter
    private final int clientId;

    @Getter
    private Money available = Money.ZERO;

    @Getter
    private Money held = Money.ZERO;

    @Getter
    private Money total = Money.ZERO;

    @Getter
    private boolean locked;

    // settled deposits and withdrawals, by transaction ID
    private final Map<Long, LedgerRecord> ledger = new HashMap<>();

    // never pruned: a pre-freeze dispute must stay resolvable
    private final Map<Long, DisputeState> disputes = new HashMap<>();

    public ClientAccount(int clientId) {
        this.clientId = clientId;
    }

    /**
     * Settles a deposit or withdrawal.
     *
     * Checks, in order: account not locked, amount present, amount not negative.
     * A withdrawal larger than the available funds is discarded and never
     * recorded, so it cannot be disputed later.
     *
     * @param tx a DEPOSIT or WITHDRAWAL
     * @return APPLIED, or the reason the transaction was discarded
     * @throws IllegalArgumentException if the transaction is dispute-related
     */
    public Outcome settle(Transaction tx) {
        if (tx.isDisputeRelated()) {
            throw new IllegalArgumentException("Cannot settle a " + tx.getType() + " transaction: " + tx);
        }

        if (locked) {
            log.warn("Discarding {} on locked account: {}", tx.getType(), tx);
            return Outcome.ACCOUNT_LOCKED;
        }

        Optional<Money> requested = tx.findAmount();
        if (requested.isEmpty()) {
            log.warn("Discarding {} without amount: {}", tx.getType(), tx);
            return Outcome.MISSING_AMOUNT;
        }
        Money amount = requested.get();
        if (amount.isNegative()) {
            log.warn("Discarding {} with negative amount: {}", tx.getType(), tx);
            return Outcome.NEGATIVE_AMOUNT;
        }

        if (tx.getType() == TransactionType.DEPOSIT) {
            available = available.plus(amount);
            total = total.plus(amount);
        } else {
            if (available.isLessThan(amount)) {
                log.warn("Discarding withdrawal with insufficient funds: available={}, tx={}", available, tx);
                return Outcome.INSUFFICIENT_FUNDS;
            }
            available = available.minus(amount);
            total = total.minus(amount);
        }

        ledger.put(tx.getTransactionId(), new LedgerRecord(tx.getType(), amount));
        return Outcome.APPLIED;
    }

    /**
     * Adjudicates a dispute, resolve or chargeback against a settled transaction.
     *
     * Once the account is locked no new dispute is accepted, but disputes
     * opened before the freeze can still be resolved or charged back,
     * each independently.
     *
     * @param tx a DISPUTE, RESOLVE or CHARGEBACK
     * @return APPLIED, or the reason the transaction was discarded
     * @throws IllegalArgumentException if the transaction is a deposit or withdrawal
     */
    public Outcome adjudicate(Transaction tx) {
        if (!tx.isDisputeRelated()) {
            throw new IllegalArgumentException("Cannot adjudicate a " + tx.getType() + " transaction: " + tx);
        }

        LedgerRecord record = ledger.get(tx.getTransactionId());
        if (record == null) {
            log.warn("Discarding {} for unknown transaction: {}", tx.getType(), tx);
            return Outcome.UNKNOWN_TRANSACTION;
        }

        return switch (tx.getType()) {
            case DISPUTE -> openDispute(tx, record);
            case RESOLVE -> resolve(tx, record);
            case CHARGEBACK -> chargeBack(tx, record);
            case DEPOSIT, WITHDRAWAL -> throw new IllegalStateException("unreachable");
        };
    }

    private Outcome openDispute(Transaction tx, LedgerRecord record) {
        if (locked) {
            log.warn("Discarding new dispute on locked account {}: {}", clientId, tx);
            return Outcome.ACCOUNT_LOCKED;
        }
        DisputeState existing = disputes.get(tx.getTransactionId());
        if (existing != null) {
            log.warn("Discarding dispute for transaction already {}: {}", existing, tx);
            return Outcome.ALREADY_DISPUTED;
        }
        if (!record.isDeposit()) {
            log.warn("Discarding dispute of a {}: {}", record.getType(), tx);
            return Outcome.NOT_DISPUTABLE;
        }

        available = available.minus(record.getAmount());
        held = held.plus(record.getAmount());
        disputes.put(tx.getTransactionId(), DisputeState.DISPUTED);
        return Outcome.APPLIED;
    }

    private Outcome resolve(Transaction tx, LedgerRecord record) {
        if (!canMoveTo(tx, DisputeState.RESOLVED)) {
            return Outcome.NOT_DISPUTED;
        }

        held = held.minus(record.getAmount());
        available = available.plus(record.getAmount());
        disputes.put(tx.getTransactionId(), DisputeState.RESOLVED);
        return Outcome.APPLIED;
    }

    private Outcome chargeBack(Transaction tx, LedgerRecord record) {
        if (!canMoveTo(tx, DisputeState.CHARGED_BACK)) {
            return Outcome.NOT_DISPUTED;
        }

        held = held.minus(record.getAmount());
        total = total.minus(record.getAmount());
        locked = true;
        disputes.put(tx.getTransactionId(), DisputeState.CHARGED_BACK);
        return Outcome.APPLIED;
    }

    private boolean canMoveTo(Transaction tx, DisputeState target) {
        DisputeState current = disputes.get(tx.getTransactionId());
        if (current == null) {
            log.warn("Discarding {} for transaction that was never disputed: {}", tx.getType(), tx);
            return false;
        }
        if (!current.canTransitionTo(target)) {
            log.warn("Discarding {} for transaction already {}: {}", tx.getType(), current, tx);
            return false;
        }
        return true;
    }

    public Optional<DisputeState> findDisputeState(long transactionId) {
        return Optional.ofNullable(disputes.get(transactionId));
    }

    public Optional<LedgerRecord> findLedgerRecord(long transactionId) {
        return Optional.ofNullable(ledger.get(transactionId));
    }

    public AccountSnapshot snapshot() {
        return new AccountSnapshot(clientId, available, held, total, locked);
    }

    @Override
    public String toString() {
        return "ClientAccount{client=" + clientId
            + ", available=" + available
            + ", held=" + held
            + ", total=" + total
            + ", locked=" + locked + "}";
    }
}
