package com.flagship.collateral_engine.simulation;

import com.flagship.collateral_engine.collateral.AssetId;
import com.flagship.collateral_engine.collateral.PriceFeedId;
import com.flagship.collateral_engine.ledger.AccountId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.Map;

/**
 * Drives the in-memory collaborators: move prices, fund collateral wallets.
 * Only present in simulation mode.
 */
@RestController
@RequestMapping("/api/simulation")
@ConditionalOnProperty(name = "engine.simulation.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SimulationController {

    private final InMemoryPriceFeedDirectory priceFeeds;
    private final InMemoryCollateralVault collateralVault;
    private final InMemoryDebtToken debtToken;

    @PutMapping("/prices/{feedId}")
    public ResponseEntity<Map<String, BigInteger>> setPrice(@PathVariable("feedId") String feedId,
                                                            @RequestBody Map<String, BigInteger> body) {
        BigInteger price = body.get("price");
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("price must be a positive integer in feed precision");
        }
        priceFeeds.setPrice(PriceFeedId.of(feedId), price);
        return ResponseEntity.ok(Map.of("price", price));
    }

    @PostMapping("/collateral/{asset}/fund")
    public ResponseEntity<Map<String, BigInteger>> fund(@PathVariable("asset") String asset,
                                                        @RequestBody Map<String, String> body) {
        String account = body.get("account");
        String amount = body.get("amount");
        if (account == null || amount == null) {
            throw new IllegalArgumentException("account and amount are required");
        }
        AssetId assetId = AssetId.of(asset);
        AccountId accountId = AccountId.of(account);
        collateralVault.fund(assetId, accountId, positiveAmount(amount));
        log.info("Simulated wallet funded: account={}, asset={}, amount={}", account, asset, amount);
        return ResponseEntity.ok(Map.of("wallet_balance", collateralVault.walletBalance(assetId, accountId)));
    }

    @PostMapping("/debt-token/transfer")
    public ResponseEntity<Map<String, BigInteger>> transferDebtToken(@RequestBody Map<String, String> body) {
        String from = body.get("from");
        String to = body.get("to");
        String amount = body.get("amount");
        if (from == null || to == null || amount == null) {
            throw new IllegalArgumentException("from, to and amount are required");
        }
        AccountId toAccount = AccountId.of(to);
        if (!debtToken.transfer(AccountId.of(from), toAccount, positiveAmount(amount))) {
            throw new IllegalArgumentException("Insufficient debt token balance for " + from);
        }
        return ResponseEntity.ok(Map.of("balance", debtToken.balanceOf(toAccount)));
    }

    private BigInteger positiveAmount(String value) {
        BigInteger amount = new BigInteger(value);
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be a positive integer, got " + value);
        }
        return amount;
    }
}
