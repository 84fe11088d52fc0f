package com.flagship.collateral_engine.simulation;

import com.flagship.collateral_engine.engine.collaborator.DebtTokenService;
import com.flagship.collateral_engine.ledger.AccountId;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Debt token kept in memory: holder balances, engine custody and total supply.
 */
public class InMemoryDebtToken implements DebtTokenService {

    private final String tokenId;
    private final Map<AccountId, BigInteger> balances = new HashMap<>();
    private BigInteger custody = BigInteger.ZERO;
    private BigInteger totalSupply = BigInteger.ZERO;

    public InMemoryDebtToken(String tokenId) {
        this.tokenId = tokenId;
    }

    @Override
    public String tokenId() {
        return tokenId;
    }

    @Override
    public synchronized boolean mint(AccountId to, BigInteger amount) {
        balances.merge(to, amount, BigInteger::add);
        totalSupply = totalSupply.add(amount);
        return true;
    }

    @Override
    public synchronized boolean pullForBurn(AccountId from, BigInteger amount) {
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) {
            return false;
        }
        balances.put(from, balance.subtract(amount));
        custody = custody.add(amount);
        return true;
    }

    @Override
    public synchronized boolean burn(BigInteger amount) {
        if (custody.compareTo(amount) < 0) {
            return false;
        }
        custody = custody.subtract(amount);
        totalSupply = totalSupply.subtract(amount);
        return true;
    }

    @Override
    public synchronized boolean returnFromCustody(AccountId to, BigInteger amount) {
        if (custody.compareTo(amount) < 0) {
            return false;
        }
        custody = custody.subtract(amount);
        balances.merge(to, amount, BigInteger::add);
        return true;
    }

    /**
     * Moves tokens between holders, as a secondary market would.
     * Refuses non-positive amounts.
     */
    public synchronized boolean transfer(AccountId from, AccountId to, BigInteger amount) {
        BigInteger balance = balanceOf(from);
        if (amount.signum() <= 0 || balance.compareTo(amount) < 0) {
            return false;
        }
        balances.put(from, balance.subtract(amount));
        balances.merge(to, amount, BigInteger::add);
        return true;
    }

    public synchronized BigInteger balanceOf(AccountId holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }

    public synchronized BigInteger custody() {
        return custody;
    }

    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }
}
