package com.flagship.collateral_engine.engine;

import com.flagship.collateral_engine.engine.exception.InvariantViolationException;
import com.flagship.collateral_engine.ledger.AccountId;
import com.flagship.collateral_engine.support.EngineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static com.flagship.collateral_engine.support.EngineFixture.WETH;
import static com.flagship.collateral_engine.support.EngineFixture.units;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Queries running on other threads while operations fail and roll back.
 *
 * Queries do not take the guard, so they must only ever see committed positions:
 * never an account emptied halfway through a rollback, never a mint that is
 * about to be rejected.
 */
class ConcurrentReadTest {

    private static final AccountId ALICE = AccountId.of("alice");
    private static final AccountId BOB = AccountId.of("bob");

    @Test
    @DisplayName("Readers never observe rolled-back or half-restored positions")
    void testReadersSeeOnlyCommittedState() throws Exception {
        EngineFixture fixture = new EngineFixture();
        AccountingEngine engine = fixture.engine();
        fixture.vault.fund(WETH, ALICE, units(1));
        fixture.vault.fund(WETH, BOB, units(5));
        engine.deposit(ALICE, WETH, units(1));
        engine.deposit(BOB, WETH, units(5));

        AtomicBoolean running = new AtomicBoolean(true);
        AtomicLong reads = new AtomicLong();
        AtomicLong wrongReads = new AtomicLong();

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> reader = executor.submit(() -> {
                while (running.get()) {
                    if (!units(5).equals(engine.collateralBalance(BOB, WETH))) {
                        wrongReads.incrementAndGet();
                    }
                    if (engine.accountInformation(ALICE).getDebt().signum() != 0) {
                        wrongReads.incrementAndGet();
                    }
                    reads.incrementAndGet();
                }
            });

            int rejected = 0;
            for (int i = 0; i < 20_000; i++) {
                try {
                    engine.mint(ALICE, units(5_000));
                } catch (InvariantViolationException e) {
                    rejected++;
                }
            }
            running.set(false);
            reader.get(10, TimeUnit.SECONDS);

            System.out.println("OUTPUT - reads: " + reads.get() + ", wrong reads: " + wrongReads.get());
            assertEquals(20_000, rejected);
        } finally {
            executor.shutdownNow();
        }

        assertTrue(reads.get() > 0);
        assertEquals(0, wrongReads.get());
        assertEquals(BigInteger.ZERO, engine.accountInformation(ALICE).getDebt());
    }
}
