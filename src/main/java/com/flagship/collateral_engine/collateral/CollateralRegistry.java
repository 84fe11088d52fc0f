package com.flagship.collateral_engine.collateral;

import com.flagship.collateral_engine.engine.exception.EngineError;
import com.flagship.collateral_engine.engine.exception.ValidationException;
import com.flagship.collateral_engine.oracle.PriceOracleAdapter;
import com.flagship.collateral_engine.oracle.PriceOracleAdapterFactory;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Approved collateral assets and their price feeds.
 *
 * Built once from parallel lists; the set of assets and their registration order
 * never change afterwards. Every portfolio valuation walks {@link #enumerate()} so
 * results are reproducible.
 */
@Slf4j
public class CollateralRegistry {

    private final List<AssetId> assets;
    private final Map<AssetId, PriceFeedId> feeds;
    private final Map<AssetId, PriceOracleAdapter> oracles;
    private final BigInteger additionalFeedPrecision;

    public CollateralRegistry(List<AssetId> assetIds, List<PriceFeedId> feedIds,
                              PriceOracleAdapterFactory oracleFactory) {
        if (assetIds == null || feedIds == null) {
            throw new ValidationException(EngineError.LENGTH_MISMATCH, "Asset and price feed lists are required");
        }
        if (assetIds.size() != feedIds.size()) {
            throw new ValidationException(EngineError.LENGTH_MISMATCH,
                String.format("Asset and price feed lists differ in length: assets=%d, feeds=%d",
                    assetIds.size(), feedIds.size()));
        }

        Map<AssetId, PriceFeedId> feedMap = new LinkedHashMap<>();
        Map<AssetId, PriceOracleAdapter> oracleMap = new LinkedHashMap<>();
        for (int i = 0; i < assetIds.size(); i++) {
            AssetId asset = assetIds.get(i);
            PriceFeedId feed = feedIds.get(i);
            if (feedMap.containsKey(asset)) {
                throw new ValidationException(EngineError.DUPLICATE_ASSET, "Asset registered twice: " + asset);
            }
            feedMap.put(asset, feed);
            oracleMap.put(asset, oracleFactory.create(feed));
        }

        this.assets = Collections.unmodifiableList(new ArrayList<>(assetIds));
        this.feeds = Collections.unmodifiableMap(feedMap);
        this.oracles = Collections.unmodifiableMap(oracleMap);
        this.additionalFeedPrecision = oracleFactory.getAdditionalFeedPrecision();

        log.info("Collateral registry initialized: assets={}", this.assets);
    }

    public boolean isAllowed(AssetId asset) {
        return asset != null && feeds.containsKey(asset);
    }

    /**
     * Approved assets in registration order.
     */
    public List<AssetId> enumerate() {
        return assets;
    }

    public Optional<PriceFeedId> priceFeedOf(AssetId asset) {
        return Optional.ofNullable(asset).map(feeds::get);
    }

    /**
     * @throws ValidationException if the asset is not approved
     */
    public PriceOracleAdapter oracleFor(AssetId asset) {
        requireAllowed(asset);
        return oracles.get(asset);
    }

    /**
     * Multiplier the oracles apply to raw feed prices.
     */
    public BigInteger getAdditionalFeedPrecision() {
        return additionalFeedPrecision;
    }

    public void requireAllowed(AssetId asset) {
        if (!isAllowed(asset)) {
            throw new ValidationException(EngineError.ASSET_NOT_ALLOWED, "Collateral asset not allowed: " + asset);
        }
    }
}
