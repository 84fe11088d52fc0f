package com.flagship.collateral_engine.engine;

import com.flagship.collateral_engine.collateral.AssetId;
import com.flagship.collateral_engine.collateral.CollateralRegistry;
import com.flagship.collateral_engine.collateral.PriceFeedId;
import com.flagship.collateral_engine.config.EngineProperties;
import com.flagship.collateral_engine.engine.collaborator.CollateralTransferService;
import com.flagship.collateral_engine.engine.collaborator.DebtTokenService;
import com.flagship.collateral_engine.engine.exception.CollaboratorFailureException;
import com.flagship.collateral_engine.engine.exception.EngineError;
import com.flagship.collateral_engine.engine.exception.EngineException;
import com.flagship.collateral_engine.engine.exception.InvariantViolationException;
import com.flagship.collateral_engine.engine.exception.LiquidationException;
import com.flagship.collateral_engine.engine.exception.ValidationException;
import com.flagship.collateral_engine.health.HealthFactorCalculator;
import com.flagship.collateral_engine.ledger.AccountId;
import com.flagship.collateral_engine.ledger.AccountPosition;
import com.flagship.collateral_engine.ledger.Amounts;
import com.flagship.collateral_engine.ledger.PositionLedger;
import com.flagship.collateral_engine.ledger.event.CollateralEvent;
import com.flagship.collateral_engine.ledger.event.CollateralEventPublisher;
import com.flagship.collateral_engine.observability.CorrelationContext;
import com.flagship.collateral_engine.observability.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Collateral and debt accounting engine.
 *
 * Every account with debt must stay over-collateralized: after any committed
 * operation its health factor is at least {@link #MIN_HEALTH_FACTOR}.
 *
 * Each mutating operation:
 * 1. Runs under the {@link ReentrancyGuard} (serialized, nested calls rejected)
 * 2. Validates input and applies ledger effects
 * 3. Checks the solvency invariant on the resulting ledger
 * 4. Only then calls the token and transfer collaborators, irreversible calls last
 *
 * Any failure restores the ledger, compensates collaborator calls that already
 * went through and discards the operation's events. Events are published only
 * after commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountingEngine {

    public static final BigInteger MIN_HEALTH_FACTOR = Amounts.PRECISION;

    private final CollateralRegistry registry;
    private final PositionLedger ledger;
    private final DebtTokenService debtToken;
    private final CollateralTransferService collateralTransfers;
    private final CollateralEventPublisher eventPublisher;
    private final EngineMetrics metrics;
    private final EngineProperties properties;
    private final ReentrancyGuard guard = new ReentrancyGuard();

    // ==================== Mutating Operations ====================

    public void deposit(AccountId account, AssetId asset, BigInteger amount) {
        execute(Operation.DEPOSIT, account, tx -> {
            ledger.depositCollateral(account, asset, amount);
            pullCollateral(tx, asset, account, amount);
            return null;
        });
    }

    /**
     * Deposits collateral and mints debt against it as one unit.
     * If the mint is refused, the pulled collateral is sent back.
     */
    public void depositAndMint(AccountId account, AssetId asset, BigInteger collateralAmount, BigInteger debtAmount) {
        execute(Operation.DEPOSIT_AND_MINT, account, tx -> {
            Amounts.requirePositive(collateralAmount, "Deposit amount");
            Amounts.requirePositive(debtAmount, "Mint amount");

            ledger.depositCollateral(account, asset, collateralAmount);
            ledger.recordMint(account, debtAmount);
            requireHealthy(account, EngineError.BREAKS_HEALTH_FACTOR);

            pullCollateral(tx, asset, account, collateralAmount);
            issueDebt(account, debtAmount);
            return null;
        });
    }

    public void mint(AccountId account, BigInteger amount) {
        execute(Operation.MINT, account, tx -> {
            ledger.recordMint(account, amount);
            requireHealthy(account, EngineError.BREAKS_HEALTH_FACTOR);

            issueDebt(account, amount);
            return null;
        });
    }

    /**
     * Repays debt with the caller's own tokens.
     * The health factor is re-verified after the debt is reduced, like every other mutation.
     */
    public void burn(AccountId account, BigInteger amount) {
        execute(Operation.BURN, account, tx -> {
            Amounts.requirePositive(amount, "Burn amount");

            ledger.recordBurn(account, amount);
            requireHealthy(account, EngineError.HEALTH_FACTOR_BROKEN);

            pullDebtForBurn(tx, account, amount);
            destroyDebt(amount);
            return null;
        });
    }

    public void redeem(AccountId from, AccountId to, AssetId asset, BigInteger amount) {
        execute(Operation.REDEEM, from, tx -> {
            ledger.withdrawCollateral(from, to, asset, amount);
            requireHealthy(from, EngineError.HEALTH_FACTOR_BROKEN);

            releaseCollateral(tx, asset, to, amount);
            return null;
        });
    }

    /**
     * Burns debt and redeems collateral in one step, solvency checked on the final state.
     */
    public void redeemForDebtRepayment(AccountId account, AssetId asset,
                                       BigInteger collateralAmount, BigInteger debtAmount) {
        execute(Operation.REDEEM_FOR_DEBT, account, tx -> {
            Amounts.requirePositive(collateralAmount, "Withdrawal amount");
            Amounts.requirePositive(debtAmount, "Burn amount");

            ledger.recordBurn(account, debtAmount);
            ledger.withdrawCollateral(account, account, asset, collateralAmount);
            requireHealthy(account, EngineError.HEALTH_FACTOR_BROKEN);

            pullDebtForBurn(tx, account, debtAmount);
            releaseCollateral(tx, asset, account, collateralAmount);
            destroyDebt(debtAmount);
            return null;
        });
    }

    /**
     * Repays {@code debtToCover} of an undercollateralized target's debt with the
     * liquidator's tokens and pays the liquidator the equivalent collateral plus bonus.
     *
     * @throws LiquidationException if the target is healthy or the liquidation would not improve it
     * @throws ValidationException if the target lacks the collateral to seize or the debt to cover
     */
    public LiquidationResult liquidate(AccountId liquidator, AssetId collateralAsset,
                                       AccountId target, BigInteger debtToCover) {
        return execute(Operation.LIQUIDATE, liquidator, tx -> {
            Amounts.requirePositive(debtToCover, "Debt to cover");
            registry.requireAllowed(collateralAsset);

            BigInteger startingHealthFactor = healthFactorOf(ledger.positionOf(target));
            if (startingHealthFactor.compareTo(MIN_HEALTH_FACTOR) >= 0) {
                throw new LiquidationException(EngineError.HEALTH_FACTOR_OK,
                    String.format("Account %s is not eligible for liquidation: health factor %s",
                        target, startingHealthFactor),
                    startingHealthFactor);
            }

            BigInteger collateralEquivalent = tokenAmountForUsd(collateralAsset, debtToCover);
            BigInteger bonus = collateralEquivalent
                .multiply(BigInteger.valueOf(properties.getLiquidationBonusPct()))
                .divide(HealthFactorCalculator.LIQUIDATION_PRECISION);
            BigInteger totalSeized = collateralEquivalent.add(bonus);
            if (totalSeized.signum() == 0) {
                throw new ValidationException(EngineError.AMOUNT_MUST_BE_POSITIVE,
                    String.format("Debt to cover %s is worth less than one unit of %s at the current price",
                        debtToCover, collateralAsset));
            }

            BigInteger available = ledger.collateralOf(target, collateralAsset);
            if (totalSeized.compareTo(available) > 0) {
                throw new ValidationException(EngineError.INSUFFICIENT_COLLATERAL,
                    String.format("Seizing %s %s exceeds the %s deposited by %s",
                        totalSeized, collateralAsset, available, target));
            }
            BigInteger outstanding = ledger.debtOf(target);
            if (debtToCover.compareTo(outstanding) > 0) {
                throw new ValidationException(EngineError.INSUFFICIENT_DEBT,
                    String.format("Cannot cover %s of debt for %s: outstanding debt is %s",
                        debtToCover, target, outstanding));
            }

            ledger.withdrawCollateral(target, liquidator, collateralAsset, totalSeized);
            ledger.recordBurn(target, debtToCover);

            BigInteger endingHealthFactor = healthFactorOf(ledger.positionOf(target));
            if (endingHealthFactor.compareTo(startingHealthFactor) <= 0) {
                throw new LiquidationException(EngineError.HEALTH_FACTOR_NOT_IMPROVED,
                    String.format("Liquidation of %s would move health factor from %s to %s",
                        target, startingHealthFactor, endingHealthFactor),
                    endingHealthFactor);
            }
            requireHealthy(liquidator, EngineError.HEALTH_FACTOR_BROKEN);

            pullDebtForBurn(tx, liquidator, debtToCover);
            releaseCollateral(tx, collateralAsset, liquidator, totalSeized);
            destroyDebt(debtToCover);

            metrics.recordLiquidation(collateralAsset.getValue());
            log.info("Liquidation executed: target={}, asset={}, debtCovered={}, seized={}, hfBefore={}, hfAfter={}",
                target, collateralAsset, debtToCover, totalSeized, startingHealthFactor, endingHealthFactor);

            return LiquidationResult.builder()
                .target(target)
                .liquidator(liquidator)
                .collateralAsset(collateralAsset)
                .debtCovered(debtToCover)
                .collateralSeized(totalSeized)
                .bonusCollateral(bonus)
                .healthFactorBefore(startingHealthFactor)
                .healthFactorAfter(endingHealthFactor)
                .build();
        });
    }

    // ==================== Read-only Queries ====================

    // Queries read the last committed state and never take the guard.

    public AccountInformation accountInformation(AccountId account) {
        AccountPosition position = ledger.committedPositionOf(account);
        return new AccountInformation(position.getDebt(), collateralValueOf(position));
    }

    public BigInteger accountCollateralValue(AccountId account) {
        return collateralValueOf(ledger.committedPositionOf(account));
    }

    /**
     * Current health factor. Accounts without debt are valued at the maximum without pricing.
     */
    public BigInteger healthFactor(AccountId account) {
        return healthFactorOf(ledger.committedPositionOf(account));
    }

    public BigInteger calculateHealthFactor(BigInteger debt, BigInteger collateralValueUsd) {
        return HealthFactorCalculator.compute(debt, collateralValueUsd,
            BigInteger.valueOf(properties.getLiquidationThresholdPct()), Amounts.PRECISION);
    }

    public AccountPosition position(AccountId account) {
        return ledger.committedPositionOf(account);
    }

    /**
     * Deposited balance; zero for unknown accounts and unapproved assets.
     */
    public BigInteger collateralBalance(AccountId account, AssetId asset) {
        if (!registry.isAllowed(asset)) {
            return BigInteger.ZERO;
        }
        return ledger.committedPositionOf(account).collateralOf(asset);
    }

    public List<AssetId> collateralAssets() {
        return registry.enumerate();
    }

    public Optional<PriceFeedId> priceFeedOf(AssetId asset) {
        return registry.priceFeedOf(asset);
    }

    public BigInteger price(AssetId asset) {
        return registry.oracleFor(asset).price();
    }

    public BigInteger usdValue(AssetId asset, BigInteger amount) {
        return registry.oracleFor(asset).usdValue(amount);
    }

    public BigInteger tokenAmountForUsd(AssetId asset, BigInteger usdAmount) {
        return registry.oracleFor(asset).tokenAmountForUsd(usdAmount);
    }

    public int getLiquidationThreshold() {
        return properties.getLiquidationThresholdPct();
    }

    public int getLiquidationBonus() {
        return properties.getLiquidationBonusPct();
    }

    public BigInteger getLiquidationPrecision() {
        return HealthFactorCalculator.LIQUIDATION_PRECISION;
    }

    public BigInteger getPrecision() {
        return Amounts.PRECISION;
    }

    public BigInteger getAdditionalFeedPrecision() {
        return registry.getAdditionalFeedPrecision();
    }

    public BigInteger getMinHealthFactor() {
        return MIN_HEALTH_FACTOR;
    }

    public String getDebtTokenId() {
        return debtToken.tokenId();
    }

    // ==================== Internals ====================

    /**
     * Total USD value of the position's collateral, summed in registry order.
     * Assets with a zero balance are skipped without consulting their oracle.
     */
    private BigInteger collateralValueOf(AccountPosition position) {
        BigInteger total = BigInteger.ZERO;
        for (AssetId asset : registry.enumerate()) {
            BigInteger balance = position.collateralOf(asset);
            if (balance.signum() > 0) {
                total = total.add(registry.oracleFor(asset).usdValue(balance));
            }
        }
        return total;
    }

    private BigInteger healthFactorOf(AccountPosition position) {
        if (position.getDebt().signum() == 0) {
            return HealthFactorCalculator.MAX_HEALTH_FACTOR;
        }
        return calculateHealthFactor(position.getDebt(), collateralValueOf(position));
    }

    private <T> T execute(Operation operation, AccountId account, Function<EngineTransaction, T> body) {
        guard.enter(operation.getTag());
        long startTime = System.currentTimeMillis();
        T result;
        List<CollateralEvent> events;
        try {
            MDC.put(CorrelationContext.OPERATION_MDC_KEY, operation.getTag());
            EngineTransaction tx = new EngineTransaction(ledger);
            try {
                result = body.apply(tx);
                events = tx.commit();
            } catch (RuntimeException e) {
                tx.rollback(e);
                recordFailure(operation, account, e, System.currentTimeMillis() - startTime);
                throw e;
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(operation.getTag(), "success");
            metrics.recordLatency(operation.getTag(), duration);
            log.info("Operation committed: account={}, events={}, duration={}ms", account, events.size(), duration);
        } finally {
            MDC.remove(CorrelationContext.OPERATION_MDC_KEY);
            guard.exit();
        }

        publish(events);
        return result;
    }

    private void recordFailure(Operation operation, AccountId account, RuntimeException e, long durationMs) {
        String outcome = e instanceof EngineException engineException
            ? engineException.getError().name().toLowerCase(Locale.ROOT)
            : "error";
        metrics.recordOperation(operation.getTag(), outcome);
        metrics.recordLatency(operation.getTag(), durationMs);
        if (e instanceof EngineException) {
            log.warn("Operation rolled back: account={}, outcome={}, error={}", account, outcome, e.getMessage());
        } else {
            log.error("Operation rolled back on unexpected error: account={}", account, e);
        }
    }

    private void publish(List<CollateralEvent> events) {
        for (CollateralEvent event : events) {
            try {
                eventPublisher.publish(event);
            } catch (RuntimeException e) {
                // Already committed; a listener failure must not look like an operation failure.
                log.error("Event listener failed after commit: eventType={}, eventId={}, error={}",
                    event.getEventType(), event.getEventId(), e.getMessage());
            }
        }
    }

    private void requireHealthy(AccountId account, EngineError error) {
        BigInteger healthFactor = healthFactorOf(ledger.positionOf(account));
        if (healthFactor.compareTo(MIN_HEALTH_FACTOR) < 0) {
            throw new InvariantViolationException(error, healthFactor);
        }
    }

    private void pullCollateral(EngineTransaction tx, AssetId asset, AccountId from, BigInteger amount) {
        invoke(EngineError.TRANSFER_FAILED, String.format("Transfer of %s %s from %s", amount, asset, from),
            () -> collateralTransfers.transferIn(asset, from, amount));
        tx.onRollback(String.format("return %s %s to %s", amount, asset, from),
            () -> collateralTransfers.transferOut(asset, from, amount));
    }

    private void releaseCollateral(EngineTransaction tx, AssetId asset, AccountId to, BigInteger amount) {
        invoke(EngineError.TRANSFER_FAILED, String.format("Transfer of %s %s to %s", amount, asset, to),
            () -> collateralTransfers.transferOut(asset, to, amount));
        tx.onRollback(String.format("reclaim %s %s from %s", amount, asset, to),
            () -> collateralTransfers.transferIn(asset, to, amount));
    }

    private void issueDebt(AccountId to, BigInteger amount) {
        invoke(EngineError.MINT_FAILED, String.format("Mint of %s to %s", amount, to),
            () -> debtToken.mint(to, amount));
    }

    private void pullDebtForBurn(EngineTransaction tx, AccountId from, BigInteger amount) {
        invoke(EngineError.TRANSFER_FAILED, String.format("Pull of %s debt tokens from %s", amount, from),
            () -> debtToken.pullForBurn(from, amount));
        tx.onRollback(String.format("return %s debt tokens to %s", amount, from),
            () -> debtToken.returnFromCustody(from, amount));
    }

    private void destroyDebt(BigInteger amount) {
        invoke(EngineError.BURN_FAILED, String.format("Burn of %s debt tokens", amount),
            () -> debtToken.burn(amount));
    }

    private void invoke(EngineError failure, String description, BooleanSupplier call) {
        boolean accepted;
        try {
            accepted = call.getAsBoolean();
        } catch (EngineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException(failure, description + " failed: " + e.getMessage(), e);
        }
        if (!accepted) {
            throw new CollaboratorFailureException(failure, description + " was refused");
        }
    }
}
