package com.flagship.collateral_engine.api;

import com.flagship.collateral_engine.api.dto.AccountResponse;
import com.flagship.collateral_engine.api.dto.CollateralAssetResponse;
import com.flagship.collateral_engine.api.dto.DebtRequest;
import com.flagship.collateral_engine.api.dto.DepositRequest;
import com.flagship.collateral_engine.api.dto.LiquidationRequest;
import com.flagship.collateral_engine.api.dto.LiquidationResponse;
import com.flagship.collateral_engine.api.dto.ParametersResponse;
import com.flagship.collateral_engine.api.dto.PriceResponse;
import com.flagship.collateral_engine.api.dto.RedeemRequest;
import com.flagship.collateral_engine.collateral.AssetId;
import com.flagship.collateral_engine.engine.AccountInformation;
import com.flagship.collateral_engine.engine.AccountingEngine;
import com.flagship.collateral_engine.engine.LiquidationResult;
import com.flagship.collateral_engine.engine.exception.OracleFailureException;
import com.flagship.collateral_engine.ledger.AccountId;
import com.flagship.collateral_engine.ledger.AccountPosition;
import com.flagship.collateral_engine.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST Controller for the collateral engine.
 *
 * The calling account is identified by the X-Account-Id header. Mutating endpoints
 * return the caller's position after the operation committed.
 */
@RestController
@RequestMapping("/api/engine")
@RequiredArgsConstructor
@Slf4j
public class EngineController {

    private static final String ACCOUNT_HEADER = CorrelationContext.ACCOUNT_ID_HEADER;

    private final AccountingEngine engine;

    @PostMapping("/collateral/deposit")
    public ResponseEntity<AccountResponse> deposit(@RequestHeader(ACCOUNT_HEADER) String caller,
                                                   @Valid @RequestBody DepositRequest request) {
        AccountId account = AccountId.of(caller);
        log.info("Deposit requested: asset={}, amount={}", request.getAsset(), request.getAmount());
        engine.deposit(account, AssetId.of(request.getAsset()), request.getAmount());
        return ResponseEntity.ok(describe(account));
    }

    @PostMapping("/collateral/deposit-and-mint")
    public ResponseEntity<AccountResponse> depositAndMint(@RequestHeader(ACCOUNT_HEADER) String caller,
                                                          @Valid @RequestBody DepositRequest request) {
        AccountId account = AccountId.of(caller);
        log.info("Deposit and mint requested: asset={}, amount={}, debtAmount={}",
            request.getAsset(), request.getAmount(), request.getDebtAmount());
        engine.depositAndMint(account, AssetId.of(request.getAsset()), request.getAmount(), request.getDebtAmount());
        return ResponseEntity.ok(describe(account));
    }

    @PostMapping("/collateral/redeem")
    public ResponseEntity<AccountResponse> redeem(@RequestHeader(ACCOUNT_HEADER) String caller,
                                                  @Valid @RequestBody RedeemRequest request) {
        AccountId account = AccountId.of(caller);
        log.info("Redeem requested: asset={}, amount={}", request.getAsset(), request.getAmount());
        engine.redeem(account, account, AssetId.of(request.getAsset()), request.getAmount());
        return ResponseEntity.ok(describe(account));
    }

    @PostMapping("/collateral/redeem-for-debt")
    public ResponseEntity<AccountResponse> redeemForDebt(@RequestHeader(ACCOUNT_HEADER) String caller,
                                                         @Valid @RequestBody RedeemRequest request) {
        AccountId account = AccountId.of(caller);
        log.info("Redeem for debt requested: asset={}, amount={}, debtAmount={}",
            request.getAsset(), request.getAmount(), request.getDebtAmount());
        engine.redeemForDebtRepayment(account, AssetId.of(request.getAsset()),
            request.getAmount(), request.getDebtAmount());
        return ResponseEntity.ok(describe(account));
    }

    @PostMapping("/debt/mint")
    public ResponseEntity<AccountResponse> mint(@RequestHeader(ACCOUNT_HEADER) String caller,
                                                @Valid @RequestBody DebtRequest request) {
        AccountId account = AccountId.of(caller);
        engine.mint(account, request.getAmount());
        return ResponseEntity.ok(describe(account));
    }

    @PostMapping("/debt/burn")
    public ResponseEntity<AccountResponse> burn(@RequestHeader(ACCOUNT_HEADER) String caller,
                                                @Valid @RequestBody DebtRequest request) {
        AccountId account = AccountId.of(caller);
        engine.burn(account, request.getAmount());
        return ResponseEntity.ok(describe(account));
    }

    @PostMapping("/liquidations")
    public ResponseEntity<LiquidationResponse> liquidate(@RequestHeader(ACCOUNT_HEADER) String caller,
                                                         @Valid @RequestBody LiquidationRequest request) {
        log.info("Liquidation requested: target={}, asset={}, debtToCover={}",
            request.getTargetAccount(), request.getCollateralAsset(), request.getDebtToCover());
        LiquidationResult result = engine.liquidate(
            AccountId.of(caller),
            AssetId.of(request.getCollateralAsset()),
            AccountId.of(request.getTargetAccount()),
            request.getDebtToCover());
        return ResponseEntity.ok(LiquidationResponse.from(result));
    }

    @GetMapping("/accounts/{account}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("account") String account) {
        return ResponseEntity.ok(describe(AccountId.of(account)));
    }

    @GetMapping("/accounts/{account}/collateral/{asset}")
    public ResponseEntity<Map<String, BigInteger>> getCollateralBalance(@PathVariable("account") String account,
                                                                        @PathVariable("asset") String asset) {
        BigInteger balance = engine.collateralBalance(AccountId.of(account), AssetId.of(asset));
        return ResponseEntity.ok(Map.of("balance", balance));
    }

    @GetMapping("/collateral")
    public ResponseEntity<List<CollateralAssetResponse>> getCollateralAssets() {
        List<CollateralAssetResponse> assets = engine.collateralAssets().stream()
            .map(asset -> new CollateralAssetResponse(asset.getValue(),
                engine.priceFeedOf(asset).map(Object::toString).orElse(null)))
            .toList();
        return ResponseEntity.ok(assets);
    }

    @GetMapping("/prices/{asset}")
    public ResponseEntity<PriceResponse> getPrice(@PathVariable("asset") String asset) {
        return ResponseEntity.ok(new PriceResponse(asset, engine.price(AssetId.of(asset))));
    }

    @GetMapping("/parameters")
    public ResponseEntity<ParametersResponse> getParameters() {
        return ResponseEntity.ok(ParametersResponse.builder()
            .debtToken(engine.getDebtTokenId())
            .liquidationThresholdPct(engine.getLiquidationThreshold())
            .liquidationBonusPct(engine.getLiquidationBonus())
            .liquidationPrecision(engine.getLiquidationPrecision())
            .precision(engine.getPrecision())
            .additionalFeedPrecision(engine.getAdditionalFeedPrecision())
            .minHealthFactor(engine.getMinHealthFactor())
            .build());
    }

    /**
     * Describes the committed position. When a price is stale or unavailable the
     * response carries debt and balances only.
     */
    private AccountResponse describe(AccountId account) {
        AccountPosition position = engine.position(account);
        Map<String, BigInteger> collateral = new LinkedHashMap<>();
        for (AssetId asset : engine.collateralAssets()) {
            collateral.put(asset.getValue(), position.collateralOf(asset));
        }
        AccountResponse.AccountResponseBuilder response = AccountResponse.builder()
            .account(account.getValue())
            .debt(position.getDebt())
            .collateral(collateral);

        try {
            AccountInformation info = engine.accountInformation(account);
            response.collateralValueUsd(info.getCollateralValueUsd())
                .healthFactor(engine.calculateHealthFactor(info.getDebt(), info.getCollateralValueUsd()));
        } catch (OracleFailureException e) {
            log.warn("Position reported without valuation: account={}, code={}, message={}",
                account, e.getError(), e.getMessage());
        }
        return response.build();
    }
}
