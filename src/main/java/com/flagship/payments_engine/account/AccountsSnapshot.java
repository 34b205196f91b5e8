package com.flagship.payments_engine.account;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Final state of every account created during a run, ordered by
 * ascending client ID.
 */
@EqualsAndHashCode
@ToString
public final class AccountsSnapshot {

    private static final AccountsSnapshot EMPTY = new AccountsSnapshot(List.of());

    private final List<AccountSnapshot> accounts;

    private AccountsSnapshot(List<AccountSnapshot> accounts) {
        this.accounts = accounts;
    }

    public static AccountsSnapshot empty() {
        return EMPTY;
    }

    /**
     * Builds a snapshot from accounts in any order; duplicate client IDs are rejected.
     */
    public static AccountsSnapshot of(Collection<AccountSnapshot> accounts) {
        List<AccountSnapshot> sorted = new ArrayList<>(accounts);
        sorted.sort(Comparator.comparingInt(AccountSnapshot::getClientId));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i - 1).getClientId() == sorted.get(i).getClientId()) {
                throw new IllegalArgumentException(
                    "Duplicate client in snapshot: " + sorted.get(i).getClientId());
            }
        }
        return new AccountsSnapshot(List.copyOf(sorted));
    }

    public List<AccountSnapshot> getAccounts() {
        return accounts;
    }

    public Optional<AccountSnapshot> get(int clientId) {
        return accounts.stream()
            .filter(account -> account.getClientId() == clientId)
            .findFirst();
    }

    public int size() {
        return accounts.size();
    }

    public boolean isEmpty() {
        return accounts.isEmpty();
    }
}
