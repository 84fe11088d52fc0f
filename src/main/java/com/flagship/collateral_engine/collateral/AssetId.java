package com.flagship.collateral_engine.collateral;

import lombok.Value;

import java.util.Objects;

/**
 * Identifier of an approved collateral type (for example {@code WETH}).
 */
@Value
public class AssetId {
    String value;

    private AssetId(String value) {
        this.value = Objects.requireNonNull(value, "asset id");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Asset id must not be blank");
        }
    }

    public static AssetId of(String value) {
        return new AssetId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
