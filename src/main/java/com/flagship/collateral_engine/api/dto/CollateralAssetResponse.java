package com.flagship.collateral_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class CollateralAssetResponse {

    @JsonProperty("asset")
    String asset;

    @JsonProperty("price_feed")
    String priceFeed;
}
