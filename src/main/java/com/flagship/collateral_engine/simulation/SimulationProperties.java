package com.flagship.collateral_engine.simulation;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for running the engine against in-memory collaborators.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "engine.simulation")
public class SimulationProperties {

    private boolean enabled = true;

    /** Initial feed prices in feed precision, keyed by price feed id. */
    private Map<String, BigInteger> prices = new LinkedHashMap<>();
}
