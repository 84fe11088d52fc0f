package com.flagship.collateral_engine.oracle;

import com.flagship.collateral_engine.collateral.PriceFeedId;

import java.util.Optional;

/**
 * Looks up the live feed behind a {@link PriceFeedId}.
 */
public interface PriceFeedDirectory {

    Optional<PriceFeed> find(PriceFeedId feedId);
}
