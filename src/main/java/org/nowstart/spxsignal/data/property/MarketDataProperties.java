package org.nowstart.spxsignal.data.property;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "spxsignal.market-data")
public record MarketDataProperties(
        // directory holding <SYMBOL>.csv files
        @NotBlank @DefaultValue("data/market") String csvDir,
        // underlying index symbol
        @NotBlank @DefaultValue("SPX") String symbol,
        // volatility proxy symbol aligned by timestamp
        @NotBlank @DefaultValue("VIX") String volatilitySymbol,
        // bars loaded for the live recommendation query
        @Positive @DefaultValue("300") int liveLookbackBars
) {
}
