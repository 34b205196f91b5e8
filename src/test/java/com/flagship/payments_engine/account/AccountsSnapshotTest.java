package com.flagship.payments_engine.account;

import com.flagship.payments_engine.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccountsSnapshotTest {

    private static AccountSnapshot account(int clientId) {
        return new AccountSnapshot(clientId, Money.ZERO, Money.ZERO, Money.ZERO, false);
    }

    @Test
    @DisplayName("Accounts are ordered by ascending client ID")
    void testOrdering() {
        AccountsSnapshot snapshot = AccountsSnapshot.of(List.of(account(3), account(1), account(2)));

        assertEquals(List.of(1, 2, 3),
                snapshot.getAccounts().stream().map(AccountSnapshot::getClientId).toList());
        assertEquals(3, snapshot.size());
        assertTrue(snapshot.get(2).isPresent());
        assertTrue(snapshot.get(4).isEmpty());
    }

    @Test
    @DisplayName("Duplicate client IDs are rejected")
    void testDuplicates() {
        assertThrows(IllegalArgumentException.class,
                () -> AccountsSnapshot.of(List.of(account(1), account(1))));
    }

    @Test
    @DisplayName("Empty snapshot has no accounts and is immutable")
    void testEmpty() {
        AccountsSnapshot empty = AccountsSnapshot.empty();

        assertTrue(empty.isEmpty());
        assertEquals(empty, AccountsSnapshot.of(List.of()));
        assertThrows(UnsupportedOperationException.class, () -> empty.getAccounts().add(account(1)));
    }
}
