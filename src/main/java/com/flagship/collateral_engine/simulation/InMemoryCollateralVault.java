package com.flagship.collateral_engine.simulation;

import com.flagship.collateral_engine.collateral.AssetId;
import com.flagship.collateral_engine.engine.collaborator.CollateralTransferService;
import com.flagship.collateral_engine.ledger.AccountId;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Collateral wallets per account and the engine vault, kept in memory.
 * A transfer is refused when the paying side lacks the amount.
 */
public class InMemoryCollateralVault implements CollateralTransferService {

    private final Map<AssetId, Map<AccountId, BigInteger>> wallets = new HashMap<>();
    private final Map<AssetId, BigInteger> vault = new HashMap<>();

    public synchronized void fund(AssetId asset, AccountId account, BigInteger amount) {
        wallets.computeIfAbsent(asset, a -> new HashMap<>()).merge(account, amount, BigInteger::add);
    }

    @Override
    public synchronized boolean transferIn(AssetId asset, AccountId from, BigInteger amount) {
        BigInteger balance = walletBalance(asset, from);
        if (balance.compareTo(amount) < 0) {
            return false;
        }
        wallets.get(asset).put(from, balance.subtract(amount));
        vault.merge(asset, amount, BigInteger::add);
        return true;
    }

    @Override
    public synchronized boolean transferOut(AssetId asset, AccountId to, BigInteger amount) {
        BigInteger held = vaultBalance(asset);
        if (held.compareTo(amount) < 0) {
            return false;
        }
        vault.put(asset, held.subtract(amount));
        wallets.computeIfAbsent(asset, a -> new HashMap<>()).merge(to, amount, BigInteger::add);
        return true;
    }

    public synchronized BigInteger walletBalance(AssetId asset, AccountId account) {
        return wallets.getOrDefault(asset, Map.of()).getOrDefault(account, BigInteger.ZERO);
    }

    public synchronized BigInteger vaultBalance(AssetId asset) {
        return vault.getOrDefault(asset, BigInteger.ZERO);
    }
}
