package com.flagship.collateral_engine.collateral;

import lombok.Value;

import java.util.Objects;

/**
 * Identifier of the external price source bound to one collateral asset.
 */
@Value
public class PriceFeedId {
    String value;

    private PriceFeedId(String value) {
        this.value = Objects.requireNonNull(value, "price feed id");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Price feed id must not be blank");
        }
    }

    public static PriceFeedId of(String value) {
        return new PriceFeedId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
