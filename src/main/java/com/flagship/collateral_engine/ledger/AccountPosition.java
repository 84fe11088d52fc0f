package com.flagship.collateral_engine.ledger;

import com.flagship.collateral_engine.collateral.AssetId;
import lombok.Value;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable view of one account's collateral balances and minted debt.
 * Mutations produce a new instance.
 */
@Value
public class AccountPosition {
    Map<AssetId, BigInteger> collateral;
    BigInteger debt;

    public static AccountPosition empty() {
        return new AccountPosition(Collections.emptyMap(), BigInteger.ZERO);
    }

    public BigInteger collateralOf(AssetId asset) {
        return collateral.getOrDefault(asset, BigInteger.ZERO);
    }

    AccountPosition withCollateral(AssetId asset, BigInteger amount) {
        Map<AssetId, BigInteger> updated = new LinkedHashMap<>(collateral);
        updated.put(asset, amount);
        return new AccountPosition(Collections.unmodifiableMap(updated), debt);
    }

    AccountPosition withDebt(BigInteger newDebt) {
        return new AccountPosition(collateral, newDebt);
    }
}
