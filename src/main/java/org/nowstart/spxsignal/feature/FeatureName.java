package org.nowstart.spxsignal.feature;

public enum FeatureName {
    CLOSE("close"),
    SMA_10("sma_10"),
    SMA_20("sma_20"),
    SMA_50("sma_50"),
    SMA_200("sma_200"),
    EMA_12("ema_12"),
    EMA_26("ema_26"),
    EMA_50("ema_50"),
    MACD("macd"),
    MACD_SIGNAL("macd_signal"),
    MACD_HIST("macd_hist"),
    RSI_14("rsi_14"),
    RSI_21("rsi_21"),
    BB_UPPER("bb_upper"),
    BB_MIDDLE("bb_middle"),
    BB_LOWER("bb_lower"),
    BB_WIDTH("bb_width"),
    BB_POSITION("bb_position"),
    ATR("atr"),
    ATR_AVG("atr_avg"),
    ADX("adx"),
    PLUS_DI("plus_di"),
    MINUS_DI("minus_di"),
    STOCH_K("stoch_k"),
    STOCH_D("stoch_d"),
    WILLIAMS_R("williams_r"),
    CCI("cci"),
    MFI("mfi"),
    OBV("obv"),
    MOMENTUM("momentum"),
    RATE_OF_CHANGE("rate_of_change"),
    VOLATILITY("volatility"),
    VOLUME_SMA("volume_sma"),
    VOLUME_RATIO("volume_ratio"),
    PRICE_SMA20_RATIO("price_sma20_ratio"),
    PRICE_SMA50_RATIO("price_sma50_ratio"),
    SMA20_SMA50_RATIO("sma20_sma50_ratio"),
    RSI_14_LAG1("rsi_14_lag1"),
    RSI_14_LAG2("rsi_14_lag2"),
    MACD_LAG1("macd_lag1"),
    MACD_LAG2("macd_lag2"),
    VOLUME_RATIO_LAG1("volume_ratio_lag1"),
    VOLUME_RATIO_LAG2("volume_ratio_lag2"),
    ATR_LAG1("atr_lag1"),
    ATR_AVG_LAG1("atr_avg_lag1"),
    BB_WIDTH_LAG1("bb_width_lag1"),
    VOLATILITY_INDEX("volatility_index");

    private final String key;

    FeatureName(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
