package com.flagship.collateral_engine.engine;

import com.flagship.collateral_engine.collateral.AssetId;
import com.flagship.collateral_engine.engine.exception.EngineException;
import com.flagship.collateral_engine.ledger.AccountId;
import com.flagship.collateral_engine.support.EngineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Random;

import static com.flagship.collateral_engine.support.EngineFixture.ETH_USD;
import static com.flagship.collateral_engine.support.EngineFixture.WBTC;
import static com.flagship.collateral_engine.support.EngineFixture.WETH;
import static com.flagship.collateral_engine.support.EngineFixture.units;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Random operation sequences with moving prices.
 *
 * After every step the books must agree with the collaborators: total debt equals
 * token supply, and vault holdings equal deposited collateral per asset.
 * Committed mints, burns and redeems must leave the caller at or above the minimum.
 */
class SolvencyInvariantTest {

    private static final List<AccountId> ACCOUNTS = List.of(
        AccountId.of("a1"), AccountId.of("a2"), AccountId.of("a3"));
    private static final List<AssetId> ASSETS = List.of(WETH, WBTC);

    @Test
    @DisplayName("Books stay consistent across 2000 random operations")
    void testRandomOperationSequence() {
        EngineFixture fixture = new EngineFixture();
        AccountingEngine engine = fixture.engine();
        Random random = new Random(42);
        ACCOUNTS.forEach(account -> {
            fixture.vault.fund(WETH, account, units(1_000));
            fixture.vault.fund(WBTC, account, units(100));
        });

        int committed = 0;
        int rejected = 0;
        for (int step = 0; step < 2000; step++) {
            AccountId account = ACCOUNTS.get(random.nextInt(ACCOUNTS.size()));
            AssetId asset = ASSETS.get(random.nextInt(ASSETS.size()));
            BigInteger amount = units(1 + random.nextInt(20));
            BigInteger debt = units(1 + random.nextInt(20_000));
            int action = random.nextInt(7);

            try {
                switch (action) {
                    case 0 -> engine.deposit(account, asset, amount);
                    case 1 -> engine.depositAndMint(account, asset, amount, debt);
                    case 2 -> engine.mint(account, debt);
                    case 3 -> engine.burn(account, debt.divide(BigInteger.TEN));
                    case 4 -> engine.redeem(account, account, asset, amount);
                    case 5 -> {
                        AccountId target = ACCOUNTS.get(random.nextInt(ACCOUNTS.size()));
                        if (!target.equals(account)) {
                            engine.liquidate(account, asset, target, debt.divide(BigInteger.TEN));
                        }
                    }
                    default -> fixture.setPrice(ETH_USD, 1000 + random.nextInt(2000));
                }
                committed++;
                if (action >= 1 && action <= 4) {
                    assertTrue(engine.healthFactor(account).compareTo(engine.getMinHealthFactor()) >= 0,
                        "step " + step + " left " + account + " undercollateralized");
                }
            } catch (EngineException e) {
                rejected++;
            }

            assertBooksBalance(fixture, engine, step);
        }

        System.out.println("OUTPUT - committed: " + committed + ", rejected: " + rejected);
        assertTrue(committed > 0);
        assertTrue(rejected > 0);
    }

    private void assertBooksBalance(EngineFixture fixture, AccountingEngine engine, int step) {
        BigInteger totalDebt = BigInteger.ZERO;
        for (AccountId account : ACCOUNTS) {
            totalDebt = totalDebt.add(engine.accountInformation(account).getDebt());
        }
        assertEquals(fixture.token.totalSupply(), totalDebt, "debt vs supply at step " + step);
        assertEquals(BigInteger.ZERO, fixture.token.custody(), "custody at step " + step);

        for (AssetId asset : ASSETS) {
            BigInteger deposited = BigInteger.ZERO;
            for (AccountId account : ACCOUNTS) {
                deposited = deposited.add(engine.collateralBalance(account, asset));
            }
            assertEquals(fixture.vault.vaultBalance(asset), deposited, asset + " holdings at step " + step);
        }
    }
}
