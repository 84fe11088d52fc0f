package com.flagship.collateral_engine.engine.collaborator;

import com.flagship.collateral_engine.collateral.AssetId;
import com.flagship.collateral_engine.ledger.AccountId;

import java.math.BigInteger;

/**
 * Moves collateral assets between account wallets and the engine vault.
 *
 * Each call returns {@code false} (or throws) when the transfer did not happen.
 */
public interface CollateralTransferService {

    boolean transferIn(AssetId asset, AccountId from, BigInteger amount);

    boolean transferOut(AssetId asset, AccountId to, BigInteger amount);
}
