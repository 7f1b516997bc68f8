package org.nowstart.spxsignal.feature;

import java.util.Arrays;
import org.springframework.stereotype.Component;

/**
 * Causal indicator kernels over whole price arrays.
 *
 * <p>Every output element {@code i} depends only on inputs {@code 0..i}. Elements without enough
 * history are {@code NaN}; callers translate {@code NaN} into an unavailable feature.
 */
@Component
public class IndicatorCalculator {

    private static final double TRADING_DAYS_PER_YEAR = 252.0;
    private static final double CCI_CONSTANT = 0.015;

    public double[] simpleMovingAverage(double[] values, int length) {
        int n = values.length;
        double[] sma = fillNaN(n);
        if (length <= 0) {
            return sma;
        }
        for (int i = length - 1; i < n; i++) {
            double sum = 0.0;
            boolean complete = true;
            for (int j = i - length + 1; j <= i; j++) {
                if (!Double.isFinite(values[j])) {
                    complete = false;
                    break;
                }
                sum += values[j];
            }
            if (complete) {
                sma[i] = sum / length;
            }
        }
        return sma;
    }

    /**
     * EMA seeded with the simple average of the first {@code length} finite values.
     * Leading {@code NaN} inputs are skipped so the kernel can be chained (MACD signal line).
     */
    public double[] exponentialMovingAverage(double[] values, int length) {
        int n = values.length;
        double[] ema = fillNaN(n);
        if (length <= 0) {
            return ema;
        }

        int first = firstFinite(values);
        if (first < 0 || n - first < length) {
            return ema;
        }

        double seed = 0.0;
        for (int i = first; i < first + length; i++) {
            seed += values[i];
        }
        int seedIndex = first + length - 1;
        ema[seedIndex] = seed / length;

        double alpha = 2.0 / (length + 1.0);
        for (int i = seedIndex + 1; i < n; i++) {
            if (!Double.isFinite(values[i]) || !Double.isFinite(ema[i - 1])) {
                continue;
            }
            ema[i] = (alpha * values[i]) + ((1.0 - alpha) * ema[i - 1]);
        }
        return ema;
    }

    /**
     * Wilder RSI. Zero average loss saturates to 100; a completely flat window reads 50.
     */
    public double[] relativeStrengthIndex(double[] close, int period) {
        int n = close.length;
        double[] rsi = fillNaN(n);
        if (period <= 0 || n <= period) {
            return rsi;
        }

        double gainSum = 0.0;
        double lossSum = 0.0;
        for (int i = 1; i <= period; i++) {
            double delta = close[i] - close[i - 1];
            gainSum += Math.max(delta, 0.0);
            lossSum += Math.max(-delta, 0.0);
        }
        double avgGain = gainSum / period;
        double avgLoss = lossSum / period;
        rsi[period] = rsiValue(avgGain, avgLoss);

        for (int i = period + 1; i < n; i++) {
            double delta = close[i] - close[i - 1];
            avgGain = ((avgGain * (period - 1)) + Math.max(delta, 0.0)) / period;
            avgLoss = ((avgLoss * (period - 1)) + Math.max(-delta, 0.0)) / period;
            rsi[i] = rsiValue(avgGain, avgLoss);
        }
        return rsi;
    }

    public MacdSeries macd(double[] close, int fastLength, int slowLength, int signalLength) {
        double[] fast = exponentialMovingAverage(close, fastLength);
        double[] slow = exponentialMovingAverage(close, slowLength);
        int n = close.length;
        double[] line = fillNaN(n);
        for (int i = 0; i < n; i++) {
            if (Double.isFinite(fast[i]) && Double.isFinite(slow[i])) {
                line[i] = fast[i] - slow[i];
            }
        }
        double[] signal = exponentialMovingAverage(line, signalLength);
        double[] histogram = fillNaN(n);
        for (int i = 0; i < n; i++) {
            if (Double.isFinite(line[i]) && Double.isFinite(signal[i])) {
                histogram[i] = line[i] - signal[i];
            }
        }
        return new MacdSeries(line, signal, histogram);
    }

    /**
     * Bollinger bands with population standard deviation. Width and position are undefined on a
     * zero-width band.
     */
    public BollingerSeries bollingerBands(double[] close, int length, double deviations) {
        int n = close.length;
        double[] middle = simpleMovingAverage(close, length);
        double[] upper = fillNaN(n);
        double[] lower = fillNaN(n);
        double[] width = fillNaN(n);
        double[] position = fillNaN(n);

        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(middle[i])) {
                continue;
            }
            double variance = 0.0;
            for (int j = i - length + 1; j <= i; j++) {
                double diff = close[j] - middle[i];
                variance += diff * diff;
            }
            double std = Math.sqrt(variance / length);
            upper[i] = middle[i] + (deviations * std);
            lower[i] = middle[i] - (deviations * std);

            double band = upper[i] - lower[i];
            if (middle[i] != 0.0) {
                width[i] = band / middle[i];
            }
            if (band > 0.0) {
                position[i] = (close[i] - lower[i]) / band;
            }
        }
        return new BollingerSeries(upper, middle, lower, width, position);
    }

    public double[] trueRange(double[] high, double[] low, double[] close) {
        int n = close.length;
        double[] tr = new double[n];
        if (n == 0) {
            return tr;
        }
        tr[0] = high[0] - low[0];
        for (int i = 1; i < n; i++) {
            double highLow = high[i] - low[i];
            double highPrevClose = Math.abs(high[i] - close[i - 1]);
            double lowPrevClose = Math.abs(low[i] - close[i - 1]);
            tr[i] = Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
        }
        return tr;
    }

    public double[] wilderAtr(double[] high, double[] low, double[] close, int period) {
        int n = close.length;
        double[] atr = fillNaN(n);
        if (period <= 0 || n < period) {
            return atr;
        }

        double[] tr = trueRange(high, low, close);
        double total = 0.0;
        for (int i = 0; i < period; i++) {
            total += tr[i];
        }

        int first = period - 1;
        atr[first] = total / period;
        for (int i = period; i < n; i++) {
            atr[i] = ((atr[i - 1] * (period - 1)) + tr[i]) / period;
        }
        return atr;
    }

    /**
     * Wilder ADX with +DI/-DI. DI lines start at {@code period}, ADX at {@code 2 * period - 1}.
     */
    public DirectionalSeries averageDirectionalIndex(double[] high, double[] low, double[] close, int period) {
        int n = close.length;
        double[] plusDi = fillNaN(n);
        double[] minusDi = fillNaN(n);
        double[] adx = fillNaN(n);
        if (period <= 0 || n <= period) {
            return new DirectionalSeries(adx, plusDi, minusDi);
        }

        double[] tr = trueRange(high, low, close);
        double[] plusDm = new double[n];
        double[] minusDm = new double[n];
        for (int i = 1; i < n; i++) {
            double up = high[i] - high[i - 1];
            double down = low[i - 1] - low[i];
            plusDm[i] = (up > down && up > 0.0) ? up : 0.0;
            minusDm[i] = (down > up && down > 0.0) ? down : 0.0;
        }

        double smoothedTr = 0.0;
        double smoothedPlus = 0.0;
        double smoothedMinus = 0.0;
        for (int i = 1; i <= period; i++) {
            smoothedTr += tr[i];
            smoothedPlus += plusDm[i];
            smoothedMinus += minusDm[i];
        }

        double[] dx = fillNaN(n);
        for (int i = period; i < n; i++) {
            if (i > period) {
                smoothedTr = smoothedTr - (smoothedTr / period) + tr[i];
                smoothedPlus = smoothedPlus - (smoothedPlus / period) + plusDm[i];
                smoothedMinus = smoothedMinus - (smoothedMinus / period) + minusDm[i];
            }
            plusDi[i] = smoothedTr > 0.0 ? 100.0 * smoothedPlus / smoothedTr : 0.0;
            minusDi[i] = smoothedTr > 0.0 ? 100.0 * smoothedMinus / smoothedTr : 0.0;
            double diSum = plusDi[i] + minusDi[i];
            dx[i] = diSum > 0.0 ? 100.0 * Math.abs(plusDi[i] - minusDi[i]) / diSum : 0.0;
        }

        int firstAdx = (2 * period) - 1;
        if (n <= firstAdx) {
            return new DirectionalSeries(adx, plusDi, minusDi);
        }
        double dxSum = 0.0;
        for (int i = period; i <= firstAdx; i++) {
            dxSum += dx[i];
        }
        adx[firstAdx] = dxSum / period;
        for (int i = firstAdx + 1; i < n; i++) {
            adx[i] = ((adx[i - 1] * (period - 1)) + dx[i]) / period;
        }
        return new DirectionalSeries(adx, plusDi, minusDi);
    }

    /**
     * Slow stochastic. A zero high-low range reads 50.
     */
    public StochasticSeries stochastic(double[] high, double[] low, double[] close, int fastKLength, int slowKLength, int slowDLength) {
        int n = close.length;
        double[] fastK = fillNaN(n);
        for (int i = fastKLength - 1; i < n; i++) {
            double highest = Double.NEGATIVE_INFINITY;
            double lowest = Double.POSITIVE_INFINITY;
            for (int j = i - fastKLength + 1; j <= i; j++) {
                highest = Math.max(highest, high[j]);
                lowest = Math.min(lowest, low[j]);
            }
            double range = highest - lowest;
            fastK[i] = range > 0.0 ? 100.0 * (close[i] - lowest) / range : 50.0;
        }
        double[] slowK = simpleMovingAverage(fastK, slowKLength);
        double[] slowD = simpleMovingAverage(slowK, slowDLength);
        return new StochasticSeries(slowK, slowD);
    }

    /**
     * Williams %R in [-100, 0]. A zero high-low range reads -50.
     */
    public double[] williamsR(double[] high, double[] low, double[] close, int period) {
        int n = close.length;
        double[] out = fillNaN(n);
        for (int i = period - 1; i < n; i++) {
            double highest = Double.NEGATIVE_INFINITY;
            double lowest = Double.POSITIVE_INFINITY;
            for (int j = i - period + 1; j <= i; j++) {
                highest = Math.max(highest, high[j]);
                lowest = Math.min(lowest, low[j]);
            }
            double range = highest - lowest;
            out[i] = range > 0.0 ? -100.0 * (highest - close[i]) / range : -50.0;
        }
        return out;
    }

    public double[] commodityChannelIndex(double[] high, double[] low, double[] close, int period) {
        int n = close.length;
        double[] typical = typicalPrice(high, low, close);
        double[] average = simpleMovingAverage(typical, period);
        double[] out = fillNaN(n);
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(average[i])) {
                continue;
            }
            double meanDeviation = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                meanDeviation += Math.abs(typical[j] - average[i]);
            }
            meanDeviation /= period;
            out[i] = meanDeviation > 0.0 ? (typical[i] - average[i]) / (CCI_CONSTANT * meanDeviation) : 0.0;
        }
        return out;
    }

    /**
     * Money flow index. No negative flow saturates to 100; no flow at all reads 50.
     */
    public double[] moneyFlowIndex(double[] high, double[] low, double[] close, double[] volume, int period) {
        int n = close.length;
        double[] out = fillNaN(n);
        double[] typical = typicalPrice(high, low, close);
        for (int i = period; i < n; i++) {
            double positive = 0.0;
            double negative = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                double flow = typical[j] * volume[j];
                if (typical[j] > typical[j - 1]) {
                    positive += flow;
                } else if (typical[j] < typical[j - 1]) {
                    negative += flow;
                }
            }
            if (negative > 0.0) {
                out[i] = 100.0 - (100.0 / (1.0 + (positive / negative)));
            } else {
                out[i] = positive > 0.0 ? 100.0 : 50.0;
            }
        }
        return out;
    }

    public double[] onBalanceVolume(double[] close, double[] volume) {
        int n = close.length;
        double[] obv = new double[n];
        if (n == 0) {
            return obv;
        }
        obv[0] = volume[0];
        for (int i = 1; i < n; i++) {
            if (close[i] > close[i - 1]) {
                obv[i] = obv[i - 1] + volume[i];
            } else if (close[i] < close[i - 1]) {
                obv[i] = obv[i - 1] - volume[i];
            } else {
                obv[i] = obv[i - 1];
            }
        }
        return obv;
    }

    public double[] momentum(double[] close, int period) {
        int n = close.length;
        double[] out = fillNaN(n);
        for (int i = period; i < n; i++) {
            out[i] = close[i] - close[i - period];
        }
        return out;
    }

    public double[] rateOfChange(double[] close, int period) {
        int n = close.length;
        double[] out = fillNaN(n);
        for (int i = period; i < n; i++) {
            if (close[i - period] != 0.0) {
                out[i] = ((close[i] / close[i - period]) - 1.0) * 100.0;
            }
        }
        return out;
    }

    /**
     * Annualized sample standard deviation of simple close-to-close returns over {@code period} returns.
     */
    public double[] annualizedVolatility(double[] close, int period) {
        int n = close.length;
        double[] out = fillNaN(n);
        if (period < 2) {
            return out;
        }
        double[] returns = fillNaN(n);
        for (int i = 1; i < n; i++) {
            if (close[i - 1] != 0.0) {
                returns[i] = (close[i] / close[i - 1]) - 1.0;
            }
        }
        for (int i = period; i < n; i++) {
            double sum = 0.0;
            boolean complete = true;
            for (int j = i - period + 1; j <= i; j++) {
                if (!Double.isFinite(returns[j])) {
                    complete = false;
                    break;
                }
                sum += returns[j];
            }
            if (!complete) {
                continue;
            }
            double mean = sum / period;
            double squares = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                double diff = returns[j] - mean;
                squares += diff * diff;
            }
            out[i] = Math.sqrt(squares / (period - 1)) * Math.sqrt(TRADING_DAYS_PER_YEAR);
        }
        return out;
    }

    /**
     * Element-wise {@code numerator / denominator}, {@code NaN} where the denominator is zero or missing.
     */
    public double[] ratio(double[] numerator, double[] denominator) {
        int n = numerator.length;
        double[] out = fillNaN(n);
        for (int i = 0; i < n; i++) {
            if (Double.isFinite(numerator[i]) && Double.isFinite(denominator[i]) && denominator[i] != 0.0) {
                out[i] = numerator[i] / denominator[i];
            }
        }
        return out;
    }

    /**
     * Shifts values forward by {@code lag} bars; the first {@code lag} elements become {@code NaN}.
     */
    public double[] lag(double[] values, int lag) {
        int n = values.length;
        double[] out = fillNaN(n);
        for (int i = lag; i < n; i++) {
            out[i] = values[i - lag];
        }
        return out;
    }

    private double[] typicalPrice(double[] high, double[] low, double[] close) {
        int n = close.length;
        double[] typical = new double[n];
        for (int i = 0; i < n; i++) {
            typical[i] = (high[i] + low[i] + close[i]) / 3.0;
        }
        return typical;
    }

    private double rsiValue(double avgGain, double avgLoss) {
        if (avgLoss == 0.0) {
            return avgGain == 0.0 ? 50.0 : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    private int firstFinite(double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (Double.isFinite(values[i])) {
                return i;
            }
        }
        return -1;
    }

    private double[] fillNaN(int size) {
        double[] values = new double[size];
        Arrays.fill(values, Double.NaN);
        return values;
    }

    public record MacdSeries(double[] line, double[] signal, double[] histogram) {
    }

    public record BollingerSeries(double[] upper, double[] middle, double[] lower, double[] width, double[] position) {
    }

    public record DirectionalSeries(double[] adx, double[] plusDi, double[] minusDi) {
    }

    public record StochasticSeries(double[] k, double[] d) {
    }
}
