package org.nowstart.spxsignal.feature;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.spxsignal.market.Bar;
import org.nowstart.spxsignal.market.MarketSeries;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class FeatureEngine {

    public static final int RSI_FAST = 14;
    public static final int RSI_SLOW = 21;
    public static final int MACD_FAST = 12;
    public static final int MACD_SLOW = 26;
    public static final int MACD_SIGNAL = 9;
    public static final int BOLLINGER_LENGTH = 20;
    public static final double BOLLINGER_DEVIATIONS = 2.0;
    public static final int ATR_PERIOD = 14;
    public static final int ATR_AVERAGE_LENGTH = 20;
    public static final int ADX_PERIOD = 14;
    public static final int STOCH_FAST_K = 5;
    public static final int STOCH_SLOW_K = 3;
    public static final int STOCH_SLOW_D = 3;
    public static final int WILLIAMS_PERIOD = 14;
    public static final int CCI_PERIOD = 14;
    public static final int MFI_PERIOD = 14;
    public static final int MOMENTUM_PERIOD = 10;
    public static final int VOLATILITY_PERIOD = 20;
    public static final int VOLUME_AVERAGE_LENGTH = 20;

    private final IndicatorCalculator calculator;

    public FeatureSeries compute(MarketSeries series) {
        if (series == null) {
            throw new IllegalArgumentException("market series is required");
        }
        List<Bar> bars = series.bars();
        int n = bars.size();
        double[] high = new double[n];
        double[] low = new double[n];
        double[] close = new double[n];
        double[] volume = new double[n];
        for (int i = 0; i < n; i++) {
            Bar bar = bars.get(i);
            high[i] = bar.high();
            low[i] = bar.low();
            close[i] = bar.close();
            volume[i] = bar.volume();
        }

        Map<FeatureName, double[]> columns = new EnumMap<>(FeatureName.class);
        columns.put(FeatureName.CLOSE, close.clone());

        double[] sma20 = calculator.simpleMovingAverage(close, 20);
        double[] sma50 = calculator.simpleMovingAverage(close, 50);
        columns.put(FeatureName.SMA_10, calculator.simpleMovingAverage(close, 10));
        columns.put(FeatureName.SMA_20, sma20);
        columns.put(FeatureName.SMA_50, sma50);
        columns.put(FeatureName.SMA_200, calculator.simpleMovingAverage(close, 200));
        columns.put(FeatureName.EMA_12, calculator.exponentialMovingAverage(close, 12));
        columns.put(FeatureName.EMA_26, calculator.exponentialMovingAverage(close, 26));
        columns.put(FeatureName.EMA_50, calculator.exponentialMovingAverage(close, 50));

        IndicatorCalculator.MacdSeries macd = calculator.macd(close, MACD_FAST, MACD_SLOW, MACD_SIGNAL);
        columns.put(FeatureName.MACD, macd.line());
        columns.put(FeatureName.MACD_SIGNAL, macd.signal());
        columns.put(FeatureName.MACD_HIST, macd.histogram());

        double[] rsi14 = calculator.relativeStrengthIndex(close, RSI_FAST);
        columns.put(FeatureName.RSI_14, rsi14);
        columns.put(FeatureName.RSI_21, calculator.relativeStrengthIndex(close, RSI_SLOW));

        IndicatorCalculator.BollingerSeries bands = calculator.bollingerBands(close, BOLLINGER_LENGTH, BOLLINGER_DEVIATIONS);
        columns.put(FeatureName.BB_UPPER, bands.upper());
        columns.put(FeatureName.BB_MIDDLE, bands.middle());
        columns.put(FeatureName.BB_LOWER, bands.lower());
        columns.put(FeatureName.BB_WIDTH, bands.width());
        columns.put(FeatureName.BB_POSITION, bands.position());

        double[] atr = calculator.wilderAtr(high, low, close, ATR_PERIOD);
        double[] atrAverage = calculator.simpleMovingAverage(atr, ATR_AVERAGE_LENGTH);
        columns.put(FeatureName.ATR, atr);
        columns.put(FeatureName.ATR_AVG, atrAverage);

        IndicatorCalculator.DirectionalSeries directional = calculator.averageDirectionalIndex(high, low, close, ADX_PERIOD);
        columns.put(FeatureName.ADX, directional.adx());
        columns.put(FeatureName.PLUS_DI, directional.plusDi());
        columns.put(FeatureName.MINUS_DI, directional.minusDi());

        IndicatorCalculator.StochasticSeries stochastic = calculator.stochastic(
                high, low, close, STOCH_FAST_K, STOCH_SLOW_K, STOCH_SLOW_D);
        columns.put(FeatureName.STOCH_K, stochastic.k());
        columns.put(FeatureName.STOCH_D, stochastic.d());
        columns.put(FeatureName.WILLIAMS_R, calculator.williamsR(high, low, close, WILLIAMS_PERIOD));
        columns.put(FeatureName.CCI, calculator.commodityChannelIndex(high, low, close, CCI_PERIOD));
        columns.put(FeatureName.MFI, calculator.moneyFlowIndex(high, low, close, volume, MFI_PERIOD));
        columns.put(FeatureName.OBV, calculator.onBalanceVolume(close, volume));
        columns.put(FeatureName.MOMENTUM, calculator.momentum(close, MOMENTUM_PERIOD));
        columns.put(FeatureName.RATE_OF_CHANGE, calculator.rateOfChange(close, MOMENTUM_PERIOD));
        columns.put(FeatureName.VOLATILITY, calculator.annualizedVolatility(close, VOLATILITY_PERIOD));

        double[] volumeAverage = calculator.simpleMovingAverage(volume, VOLUME_AVERAGE_LENGTH);
        double[] volumeRatio = calculator.ratio(volume, volumeAverage);
        columns.put(FeatureName.VOLUME_SMA, volumeAverage);
        columns.put(FeatureName.VOLUME_RATIO, volumeRatio);

        columns.put(FeatureName.PRICE_SMA20_RATIO, calculator.ratio(close, sma20));
        columns.put(FeatureName.PRICE_SMA50_RATIO, calculator.ratio(close, sma50));
        columns.put(FeatureName.SMA20_SMA50_RATIO, calculator.ratio(sma20, sma50));

        columns.put(FeatureName.RSI_14_LAG1, calculator.lag(rsi14, 1));
        columns.put(FeatureName.RSI_14_LAG2, calculator.lag(rsi14, 2));
        columns.put(FeatureName.MACD_LAG1, calculator.lag(macd.line(), 1));
        columns.put(FeatureName.MACD_LAG2, calculator.lag(macd.line(), 2));
        columns.put(FeatureName.VOLUME_RATIO_LAG1, calculator.lag(volumeRatio, 1));
        columns.put(FeatureName.VOLUME_RATIO_LAG2, calculator.lag(volumeRatio, 2));
        columns.put(FeatureName.ATR_LAG1, calculator.lag(atr, 1));
        columns.put(FeatureName.ATR_AVG_LAG1, calculator.lag(atrAverage, 1));
        columns.put(FeatureName.BB_WIDTH_LAG1, calculator.lag(bands.width(), 1));

        columns.put(FeatureName.VOLATILITY_INDEX, series.alignedVolatilityClose());

        log.debug("[Feature] symbol={} bars={} columns={}", series.symbol(), n, columns.size());
        return new FeatureSeries(bars, columns);
    }
}
