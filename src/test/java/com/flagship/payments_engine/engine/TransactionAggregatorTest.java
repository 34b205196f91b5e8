package com.flagship.payments_engine.engine;

import com.flagship.payments_engine.account.AccountSnapshot;
import com.flagship.payments_engine.account.AccountsSnapshot;
import com.flagship.payments_engine.account.ClientAccount;
import com.flagship.payments_engine.account.Outcome;
import com.flagship.payments_engine.money.Money;
import com.flagship.payments_engine.transaction.Transaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Routing, duplicate gate and snapshot ordering.
 */
class TransactionAggregatorTest {

    private TransactionAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new TransactionAggregator();
    }

    private static Transaction deposit(int client, long tx, String amount) {
        return Transaction.deposit(client, tx, Money.parse(amount));
    }

    private static Transaction withdrawal(int client, long tx, String amount) {
        return Transaction.withdrawal(client, tx, Money.parse(amount));
    }

    private AccountsSnapshot applyAll(Transaction... transactions) {
        for (Transaction tx : transactions) {
            aggregator.apply(tx);
        }
        return aggregator.snapshot();
    }

    private static void assertAccount(AccountsSnapshot snapshot, int client,
                                      String available, String held, String total, boolean locked) {
        AccountSnapshot account = snapshot.get(client).orElseThrow(() -> new AssertionError("no account " + client));
        assertEquals(Money.parse(available), account.getAvailable(), "available mismatch");
        assertEquals(Money.parse(held), account.getHeld(), "held mismatch");
        assertEquals(Money.parse(total), account.getTotal(), "total mismatch");
        assertEquals(locked, account.isLocked(), "locked mismatch");
    }

    @Test
    @DisplayName("Scenario: single deposit")
    void testSingleDeposit() {
        AccountsSnapshot snapshot = applyAll(deposit(1, 1, "10.0"));

        assertEquals(1, snapshot.size());
        assertAccount(snapshot, 1, "10", "0", "10", false);
    }

    @Test
    @DisplayName("Scenario: withdrawal over available funds is rejected")
    void testOverdraft() {
        AccountsSnapshot snapshot = applyAll(deposit(1, 1, "10.0"), withdrawal(1, 2, "15.0"));

        assertAccount(snapshot, 1, "10", "0", "10", false);
    }

    @Test
    @DisplayName("Scenario: dispute then chargeback empties and locks the account")
    void testDisputeChargeback() {
        AccountsSnapshot snapshot = applyAll(
                deposit(1, 1, "10.0"),
                Transaction.dispute(1, 1),
                Transaction.chargeback(1, 1));

        assertAccount(snapshot, 1, "0", "0", "0", true);
    }

    @Test
    @DisplayName("Scenario: pre-freeze dispute resolves after the chargeback")
    void testPreFreezeResolve() {
        AccountsSnapshot snapshot = applyAll(
                deposit(1, 1, "10.0"),
                deposit(1, 2, "5.0"),
                Transaction.dispute(1, 1),
                Transaction.dispute(1, 2),
                Transaction.chargeback(1, 1),
                Transaction.resolve(1, 2));

        assertAccount(snapshot, 1, "5", "0", "5", true);
    }

    @Test
    @DisplayName("Scenario: transaction ID reused by another client is rejected before an account exists")
    void testDuplicateIdAcrossClients() {
        assertEquals(Outcome.APPLIED, aggregator.apply(deposit(1, 1, "100")));
        assertEquals(Outcome.DUPLICATE_TRANSACTION, aggregator.apply(deposit(2, 1, "500")));

        AccountsSnapshot snapshot = aggregator.snapshot();
        assertEquals(1, snapshot.size());
        assertTrue(snapshot.get(2).isEmpty(), "second client must never get an account");
        assertAccount(snapshot, 1, "100", "0", "100", false);
    }

    @Test
    @DisplayName("Resubmitting a deposit ID yields the same state as submitting it once")
    void testDuplicateDepositIsIdempotent() {
        TransactionAggregator once = new TransactionAggregator();
        once.apply(deposit(1, 1, "10"));
        once.apply(Transaction.dispute(1, 1));

        applyAll(deposit(1, 1, "10"), deposit(1, 1, "999"), Transaction.dispute(1, 1));

        assertEquals(once.snapshot(), aggregator.snapshot());
    }

    @Test
    @DisplayName("A duplicate never overwrites the ledger entry used by disputes")
    void testDuplicateDoesNotOverwriteLedger() {
        applyAll(deposit(1, 1, "10"), deposit(1, 1, "500"), Transaction.dispute(1, 1));

        ClientAccount account = aggregator.findAccount(1).orElseThrow();
        assertEquals(Money.parse("10"), account.getHeld());
        assertEquals(Money.parse("10"), account.findLedgerRecord(1).orElseThrow().getAmount());
    }

    @Test
    @DisplayName("A rejected settlement still consumes its transaction ID")
    void testRejectedSettlementConsumesId() {
        assertEquals(Outcome.INSUFFICIENT_FUNDS, aggregator.apply(withdrawal(1, 1, "5")));
        assertTrue(aggregator.hasProcessed(1));

        assertEquals(Outcome.DUPLICATE_TRANSACTION, aggregator.apply(deposit(1, 1, "5")));
        assertAccount(aggregator.snapshot(), 1, "0", "0", "0", false);
    }

    @Test
    @DisplayName("A rejected settlement still creates the account")
    void testRejectedSettlementCreatesAccount() {
        AccountsSnapshot snapshot = applyAll(withdrawal(7, 1, "5"));

        assertAccount(snapshot, 7, "0", "0", "0", false);
    }

    @Test
    @DisplayName("Disputes for a client without an account are discarded and create nothing")
    void testDisputeForUnknownClient() {
        assertEquals(Outcome.UNKNOWN_CLIENT, aggregator.apply(Transaction.dispute(5, 1)));
        assertEquals(Outcome.UNKNOWN_CLIENT, aggregator.apply(Transaction.resolve(5, 1)));
        assertEquals(Outcome.UNKNOWN_CLIENT, aggregator.apply(Transaction.chargeback(5, 1)));

        assertTrue(aggregator.snapshot().isEmpty());
    }

    @Test
    @DisplayName("Disputes are scoped to the client that settled the transaction")
    void testDisputeAgainstOtherClientsTransaction() {
        applyAll(deposit(1, 1, "10"), deposit(2, 2, "20"));

        assertEquals(Outcome.UNKNOWN_TRANSACTION, aggregator.apply(Transaction.dispute(2, 1)));
        assertAccount(aggregator.snapshot(), 1, "10", "0", "10", false);
        assertAccount(aggregator.snapshot(), 2, "20", "0", "20", false);
    }

    @Test
    @DisplayName("Dispute-related transactions do not enter the processed ID set")
    void testDisputesDoNotConsumeIds() {
        applyAll(deposit(1, 1, "10"), Transaction.dispute(1, 2));

        assertFalse(aggregator.hasProcessed(2));
        assertEquals(Outcome.APPLIED, aggregator.apply(deposit(1, 2, "1")));
    }

    @Test
    @DisplayName("Snapshot lists every account in ascending client order")
    void testSnapshotOrder() {
        AccountsSnapshot snapshot = applyAll(
                deposit(3, 1, "1"),
                deposit(1, 2, "1"),
                deposit(65535, 3, "1"),
                deposit(2, 4, "1"));

        assertEquals(List.of(1, 2, 3, 65535),
                snapshot.getAccounts().stream().map(AccountSnapshot::getClientId).toList());
    }

    @Test
    @DisplayName("total == available + held holds after every transaction of a random stream")
    void testBalanceInvariantOnRandomStream() {
        Random random = new Random(42);
        long nextTx = 1;

        for (int i = 0; i < 5_000; i++) {
            int client = random.nextInt(5);
            Transaction tx = switch (random.nextInt(6)) {
                case 0, 1 -> Transaction.deposit(client, nextTx++, Money.ofScaled(random.nextInt(1_000_000)));
                case 2 -> Transaction.withdrawal(client, nextTx++, Money.ofScaled(random.nextInt(1_000_000)));
                case 3 -> Transaction.dispute(client, 1 + random.nextInt((int) nextTx));
                case 4 -> Transaction.resolve(client, 1 + random.nextInt((int) nextTx));
                default -> Transaction.chargeback(client, 1 + random.nextInt((int) nextTx));
            };
            aggregator.apply(tx);

            aggregator.findAccount(client).ifPresent(account ->
                    assertEquals(account.getTotal(), account.getAvailable().plus(account.getHeld()),
                            "invariant broken after " + tx));
        }
    }
}
