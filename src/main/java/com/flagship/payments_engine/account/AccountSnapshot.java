package com.flagship.payments_engine.account;

import com.flagship.payments_engine.money.Money;
import lombok.Value;

/**
 * Final, immutable view of one client account.
 */
@Value
public class AccountSnapshot {
    int clientId;
    Money available;
    Money held;
    Money total;
    boolean locked;
}
