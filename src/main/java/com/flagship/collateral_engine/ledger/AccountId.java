package com.flagship.collateral_engine.ledger;

import lombok.Value;

import java.util.Objects;

/**
 * Caller identity that owns a position.
 */
@Value
public class AccountId {
    String value;

    private AccountId(String value) {
        this.value = Objects.requireNonNull(value, "account id");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Account id must not be blank");
        }
    }

    public static AccountId of(String value) {
        return new AccountId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
