package com.flagship.collateral_engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunable engine parameters, bound from {@code engine.*}.
 *
 * The collateral lists are parallel: the n-th asset is priced by the n-th feed.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    @NotBlank
    private String debtTokenId = "DSC";

    /** Share of collateral value (percent) that counts toward solvency. */
    @Min(1)
    @Max(100)
    private int liquidationThresholdPct = 50;

    /** Extra collateral (percent) awarded to a liquidator. */
    @Min(0)
    @Max(100)
    private int liquidationBonusPct = 10;

    @Valid
    @NotNull
    private Oracle oracle = new Oracle();

    @Valid
    @NotNull
    private Collateral collateral = new Collateral();

    @Getter
    @Setter
    public static class Oracle {
        @Min(0)
        @Max(18)
        private int feedDecimals = 8;

        @NotNull
        private Duration staleAfter = Duration.ofHours(3);
    }

    @Getter
    @Setter
    public static class Collateral {
        private List<String> assets = new ArrayList<>();
        private List<String> priceFeeds = new ArrayList<>();
    }
}
