package com.flagship.collateral_engine.simulation;

import com.flagship.collateral_engine.collateral.PriceFeedId;
import com.flagship.collateral_engine.config.EngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * In-memory collaborators for local runs and tests.
 * Disabled with {@code engine.simulation.enabled=false}; real collaborators must then be provided.
 */
@Configuration
@ConditionalOnProperty(name = "engine.simulation.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class SimulationConfig {

    @Bean
    public InMemoryPriceFeedDirectory priceFeedDirectory(Clock clock, SimulationProperties simulation) {
        InMemoryPriceFeedDirectory directory = new InMemoryPriceFeedDirectory(clock);
        simulation.getPrices().forEach((feed, price) -> directory.setPrice(PriceFeedId.of(feed), price));
        return directory;
    }

    @Bean
    public InMemoryDebtToken debtToken(EngineProperties properties) {
        log.warn("Using in-memory debt token '{}' (simulation mode)", properties.getDebtTokenId());
        return new InMemoryDebtToken(properties.getDebtTokenId());
    }

    @Bean
    public InMemoryCollateralVault collateralVault() {
        return new InMemoryCollateralVault();
    }
}
