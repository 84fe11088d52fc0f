package com.flagship.collateral_engine.ledger;

import com.flagship.collateral_engine.collateral.AssetId;
import com.flagship.collateral_engine.collateral.CollateralRegistry;
import com.flagship.collateral_engine.engine.exception.EngineError;
import com.flagship.collateral_engine.engine.exception.ValidationException;
import com.flagship.collateral_engine.ledger.event.CollateralDepositedEvent;
import com.flagship.collateral_engine.ledger.event.CollateralEvent;
import com.flagship.collateral_engine.ledger.event.CollateralRedeemedEvent;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Authoritative per-account collateral balances and debt.
 *
 * This class enforces the bookkeeping invariants:
 * 1. Balances and debt never go negative (explicit guards, not arithmetic traps)
 * 2. Only approved assets can be credited
 * 3. Collateral changes are recorded as pending events, handed out only on commit
 *
 * It does not know about prices or solvency; the engine checks those and uses
 * {@link #snapshot()} / {@link #restore(LedgerSnapshot)} to undo failed operations.
 *
 * Mutations and the working view ({@link #positionOf}, {@link #debtOf},
 * {@link #collateralOf}) are expected to be serialized by the caller. Readers on
 * other threads use {@link #committedPositionOf}, which only ever sees the state
 * published by the last {@link #commit()}.
 */
@Slf4j
public class PositionLedger {

    private final CollateralRegistry registry;
    private final Map<AccountId, AccountPosition> positions = new HashMap<>();
    private final List<CollateralEvent> pendingEvents = new ArrayList<>();
    private volatile Map<AccountId, AccountPosition> committed = Map.of();

    public PositionLedger(CollateralRegistry registry) {
        this.registry = registry;
    }

    public void depositCollateral(AccountId account, AssetId asset, BigInteger amount) {
        Amounts.requirePositive(amount, "Deposit amount");
        registry.requireAllowed(asset);

        AccountPosition position = positionOf(account);
        BigInteger updated = Amounts.requireInRange(position.collateralOf(asset).add(amount), "Collateral balance");
        positions.put(account, position.withCollateral(asset, updated));
        pendingEvents.add(CollateralDepositedEvent.of(account, asset, amount));

        log.debug("Collateral credited: account={}, asset={}, amount={}, balance={}", account, asset, amount, updated);
    }

    public void withdrawCollateral(AccountId account, AccountId recipient, AssetId asset, BigInteger amount) {
        Amounts.requirePositive(amount, "Withdrawal amount");
        registry.requireAllowed(asset);

        AccountPosition position = positionOf(account);
        BigInteger balance = position.collateralOf(asset);
        if (amount.compareTo(balance) > 0) {
            throw new ValidationException(EngineError.INSUFFICIENT_COLLATERAL,
                String.format("Cannot withdraw %s %s from %s: balance is %s", amount, asset, account, balance));
        }

        BigInteger updated = balance.subtract(amount);
        positions.put(account, position.withCollateral(asset, updated));
        pendingEvents.add(CollateralRedeemedEvent.of(account, recipient, asset, amount));

        log.debug("Collateral debited: from={}, to={}, asset={}, amount={}, balance={}",
            account, recipient, asset, amount, updated);
    }

    public void recordMint(AccountId account, BigInteger amount) {
        Amounts.requirePositive(amount, "Mint amount");
        AccountPosition position = positionOf(account);
        BigInteger updated = Amounts.requireInRange(position.getDebt().add(amount), "Debt");
        positions.put(account, position.withDebt(updated));
    }

    public void recordBurn(AccountId account, BigInteger amount) {
        Amounts.requirePositive(amount, "Burn amount");
        AccountPosition position = positionOf(account);
        if (amount.compareTo(position.getDebt()) > 0) {
            throw new ValidationException(EngineError.INSUFFICIENT_DEBT,
                String.format("Cannot burn %s for %s: outstanding debt is %s", amount, account, position.getDebt()));
        }
        positions.put(account, position.withDebt(position.getDebt().subtract(amount)));
    }

    public AccountPosition positionOf(AccountId account) {
        return positions.getOrDefault(account, AccountPosition.empty());
    }

    public BigInteger debtOf(AccountId account) {
        return positionOf(account).getDebt();
    }

    public BigInteger collateralOf(AccountId account, AssetId asset) {
        return positionOf(account).collateralOf(asset);
    }

    /**
     * Position as of the last commit. Safe to call from any thread.
     */
    public AccountPosition committedPositionOf(AccountId account) {
        return committed.getOrDefault(account, AccountPosition.empty());
    }

    public LedgerSnapshot snapshot() {
        return new LedgerSnapshot(Map.copyOf(positions), pendingEvents.size());
    }

    public void restore(LedgerSnapshot snapshot) {
        positions.clear();
        positions.putAll(snapshot.getPositions());
        while (pendingEvents.size() > snapshot.getPendingEventCount()) {
            pendingEvents.remove(pendingEvents.size() - 1);
        }
    }

    /**
     * Publishes the working state to readers and hands over the events recorded
     * since the last commit.
     */
    public List<CollateralEvent> commit() {
        committed = Map.copyOf(positions);
        return drainPendingEvents();
    }

    private List<CollateralEvent> drainPendingEvents() {
        List<CollateralEvent> drained = Collections.unmodifiableList(new ArrayList<>(pendingEvents));
        pendingEvents.clear();
        return drained;
    }
}
