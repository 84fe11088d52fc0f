package com.flagship.collateral_engine.config;

import com.flagship.collateral_engine.collateral.AssetId;
import com.flagship.collateral_engine.collateral.CollateralRegistry;
import com.flagship.collateral_engine.collateral.PriceFeedId;
import com.flagship.collateral_engine.ledger.PositionLedger;
import com.flagship.collateral_engine.oracle.PriceFeedDirectory;
import com.flagship.collateral_engine.oracle.PriceOracleAdapterFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the registry and ledger from {@link EngineProperties}.
 *
 * The registry is built once at startup; a length mismatch between
 * {@code engine.collateral.assets} and {@code engine.collateral.price-feeds}
 * fails the application context.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PriceOracleAdapterFactory priceOracleAdapterFactory(PriceFeedDirectory directory, Clock clock,
                                                               EngineProperties properties) {
        return new PriceOracleAdapterFactory(directory, clock,
            properties.getOracle().getStaleAfter(), properties.getOracle().getFeedDecimals());
    }

    @Bean
    public CollateralRegistry collateralRegistry(EngineProperties properties,
                                                 PriceOracleAdapterFactory oracleFactory) {
        return new CollateralRegistry(
            properties.getCollateral().getAssets().stream().map(AssetId::of).toList(),
            properties.getCollateral().getPriceFeeds().stream().map(PriceFeedId::of).toList(),
            oracleFactory);
    }

    @Bean
    public PositionLedger positionLedger(CollateralRegistry registry) {
        return new PositionLedger(registry);
    }
}
