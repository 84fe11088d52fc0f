package com.flagship.collateral_engine.engine;

import lombok.Value;

import java.math.BigInteger;

/**
 * Debt and total collateral value (USD, 18 decimals) of one account.
 */
@Value
public class AccountInformation {
    BigInteger debt;
    BigInteger collateralValueUsd;
}
