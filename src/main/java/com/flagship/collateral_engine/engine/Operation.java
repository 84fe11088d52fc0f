package com.flagship.collateral_engine.engine;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Mutating engine operations, named as they appear in logs and metrics.
 */
@Getter
@RequiredArgsConstructor
public enum Operation {
    DEPOSIT("deposit"),
    DEPOSIT_AND_MINT("deposit_and_mint"),
    MINT("mint"),
    BURN("burn"),
    REDEEM("redeem"),
    REDEEM_FOR_DEBT("redeem_for_debt"),
    LIQUIDATE("liquidate");

    private final String tag;
}
