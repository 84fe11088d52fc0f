package com.flagship.collateral_engine.ledger;

import com.flagship.collateral_engine.collateral.AssetId;
import com.flagship.collateral_engine.engine.exception.EngineError;
import com.flagship.collateral_engine.engine.exception.ValidationException;
import com.flagship.collateral_engine.ledger.event.CollateralDepositedEvent;
import com.flagship.collateral_engine.ledger.event.CollateralEvent;
import com.flagship.collateral_engine.ledger.event.CollateralRedeemedEvent;
import com.flagship.collateral_engine.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static com.flagship.collateral_engine.support.EngineFixture.WBTC;
import static com.flagship.collateral_engine.support.EngineFixture.WETH;
import static com.flagship.collateral_engine.support.EngineFixture.units;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to push the ledger into negative or unapproved balances.
 */
class PositionLedgerTest {

    private static final AccountId ALICE = AccountId.of("alice");
    private static final AccountId BOB = AccountId.of("bob");

    private PositionLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new EngineFixture().ledger;
    }

    @Test
    @DisplayName("Unknown account reads as an empty position")
    void testEmptyPosition() {
        assertEquals(BigInteger.ZERO, ledger.debtOf(ALICE));
        assertEquals(BigInteger.ZERO, ledger.collateralOf(ALICE, WETH));
        assertTrue(ledger.positionOf(ALICE).getCollateral().isEmpty());
    }

    @Test
    @DisplayName("Deposit credits the balance and records an event")
    void testDeposit() {
        ledger.depositCollateral(ALICE, WETH, units(10));
        ledger.depositCollateral(ALICE, WETH, units(5));

        assertEquals(units(15), ledger.collateralOf(ALICE, WETH));
        assertEquals(BigInteger.ZERO, ledger.collateralOf(ALICE, WBTC));

        List<CollateralEvent> events = ledger.commit();
        assertEquals(2, events.size());
        CollateralDepositedEvent first = assertInstanceOf(CollateralDepositedEvent.class, events.get(0));
        assertEquals(ALICE, first.getAccount());
        assertEquals(WETH, first.getAsset());
        assertEquals(units(10), first.getAmount());
        assertTrue(ledger.commit().isEmpty());
    }

    @Test
    @DisplayName("Zero and negative deposits are rejected")
    void testNonPositiveDeposit() {
        ValidationException zero = assertThrows(ValidationException.class,
            () -> ledger.depositCollateral(ALICE, WETH, BigInteger.ZERO));
        assertEquals(EngineError.AMOUNT_MUST_BE_POSITIVE, zero.getError());

        assertThrows(ValidationException.class, () -> ledger.depositCollateral(ALICE, WETH, BigInteger.valueOf(-1)));
        assertEquals(BigInteger.ZERO, ledger.collateralOf(ALICE, WETH));
        assertTrue(ledger.commit().isEmpty());
    }

    @Test
    @DisplayName("Unapproved asset is rejected")
    void testDisallowedAsset() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> ledger.depositCollateral(ALICE, AssetId.of("LINK"), units(1)));

        assertEquals(EngineError.ASSET_NOT_ALLOWED, e.getError());
        assertTrue(ledger.positionOf(ALICE).getCollateral().isEmpty());
    }

    @Test
    @DisplayName("Balance beyond 256 bits is rejected")
    void testOverflow() {
        ledger.depositCollateral(ALICE, WETH, Amounts.MAX_UINT256);

        ValidationException e = assertThrows(ValidationException.class,
            () -> ledger.depositCollateral(ALICE, WETH, BigInteger.ONE));
        assertEquals(EngineError.AMOUNT_OUT_OF_RANGE, e.getError());
        assertEquals(Amounts.MAX_UINT256, ledger.collateralOf(ALICE, WETH));
    }

    @Test
    @DisplayName("Withdrawing more than the balance fails explicitly")
    void testWithdrawMoreThanBalance() {
        ledger.depositCollateral(ALICE, WETH, units(1));

        ValidationException e = assertThrows(ValidationException.class,
            () -> ledger.withdrawCollateral(ALICE, ALICE, WETH, units(2)));

        assertEquals(EngineError.INSUFFICIENT_COLLATERAL, e.getError());
        assertEquals(units(1), ledger.collateralOf(ALICE, WETH));
    }

    @Test
    @DisplayName("Withdrawal to another account records from and to")
    void testWithdrawToRecipient() {
        ledger.depositCollateral(ALICE, WETH, units(3));
        ledger.commit();

        ledger.withdrawCollateral(ALICE, BOB, WETH, units(1));

        assertEquals(units(2), ledger.collateralOf(ALICE, WETH));
        assertEquals(BigInteger.ZERO, ledger.collateralOf(BOB, WETH));
        CollateralRedeemedEvent event = assertInstanceOf(CollateralRedeemedEvent.class,
            ledger.commit().get(0));
        assertEquals(ALICE, event.getFrom());
        assertEquals(BOB, event.getTo());
        assertEquals(units(1), event.getAmount());
    }

    @Test
    @DisplayName("Burning more than the debt fails")
    void testBurnMoreThanDebt() {
        ledger.recordMint(ALICE, units(100));

        ValidationException e = assertThrows(ValidationException.class,
            () -> ledger.recordBurn(ALICE, units(101)));

        assertEquals(EngineError.INSUFFICIENT_DEBT, e.getError());
        assertEquals(units(100), ledger.debtOf(ALICE));

        ledger.recordBurn(ALICE, units(100));
        assertEquals(BigInteger.ZERO, ledger.debtOf(ALICE));
    }

    @Test
    @DisplayName("Restore undoes balances and pending events taken after the snapshot")
    void testSnapshotRestore() {
        ledger.depositCollateral(ALICE, WETH, units(1));
        LedgerSnapshot snapshot = ledger.snapshot();

        ledger.depositCollateral(ALICE, WETH, units(4));
        ledger.depositCollateral(BOB, WBTC, units(2));
        ledger.recordMint(ALICE, units(50));

        ledger.restore(snapshot);

        assertEquals(units(1), ledger.collateralOf(ALICE, WETH));
        assertEquals(BigInteger.ZERO, ledger.debtOf(ALICE));
        assertEquals(BigInteger.ZERO, ledger.collateralOf(BOB, WBTC));
        assertEquals(1, ledger.commit().size());
    }

    @Test
    @DisplayName("Readers only see positions published by commit")
    void testCommittedView() {
        ledger.depositCollateral(ALICE, WETH, units(3));
        assertEquals(BigInteger.ZERO, ledger.committedPositionOf(ALICE).collateralOf(WETH));

        ledger.commit();
        assertEquals(units(3), ledger.committedPositionOf(ALICE).collateralOf(WETH));

        LedgerSnapshot snapshot = ledger.snapshot();
        ledger.recordMint(ALICE, units(10));
        ledger.depositCollateral(BOB, WBTC, units(1));
        assertEquals(BigInteger.ZERO, ledger.committedPositionOf(ALICE).getDebt());

        ledger.restore(snapshot);
        assertEquals(units(3), ledger.committedPositionOf(ALICE).collateralOf(WETH));
        assertEquals(BigInteger.ZERO, ledger.committedPositionOf(BOB).collateralOf(WBTC));
    }
}
