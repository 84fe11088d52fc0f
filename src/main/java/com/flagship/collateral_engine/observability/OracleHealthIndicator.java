package com.flagship.collateral_engine.observability;

import com.flagship.collateral_engine.collateral.AssetId;
import com.flagship.collateral_engine.collateral.CollateralRegistry;
import com.flagship.collateral_engine.oracle.PriceOracleAdapter;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports whether every collateral price feed answers with a fresh price.
 * Any stale or unreachable feed makes the engine DOWN: valuations would fail.
 */
@Component("oracles")
public class OracleHealthIndicator implements HealthIndicator {

    private final CollateralRegistry registry;

    public OracleHealthIndicator(CollateralRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        boolean allFresh = true;

        for (AssetId asset : registry.enumerate()) {
            PriceOracleAdapter oracle = registry.oracleFor(asset);
            try {
                Duration age = oracle.readingAge();
                boolean fresh = age.compareTo(oracle.getStaleAfter()) <= 0;
                allFresh &= fresh;
                details.put(asset.getValue(), Map.of(
                        "feed", oracle.getFeedId().getValue(),
                        "ageSeconds", age.getSeconds(),
                        "status", fresh ? "FRESH" : "STALE"));
            } catch (Exception e) {
                allFresh = false;
                details.put(asset.getValue(), Map.of(
                        "feed", oracle.getFeedId().getValue(),
                        "status", "UNAVAILABLE",
                        "error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            }
        }

        Health.Builder builder = allFresh ? Health.up() : Health.down();
        return builder.withDetails(details).build();
    }
}
