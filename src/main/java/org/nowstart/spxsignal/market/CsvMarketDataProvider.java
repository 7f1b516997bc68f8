package org.nowstart.spxsignal.market;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.spxsignal.data.property.MarketDataProperties;
import org.springframework.stereotype.Service;

/**
 * Reads {@code <csvDir>/<SYMBOL>.csv} with header {@code timestamp,open,high,low,close,volume}.
 *
 * <p>Rows are kept in file order; ordering problems surface as
 * {@link org.nowstart.spxsignal.data.exception.NonMonotonicTimeSeriesException} when the series is built.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CsvMarketDataProvider implements MarketDataProvider {

    static final String CSV_HEADER = "timestamp,open,high,low,close,volume";

    private final MarketDataProperties properties;

    @Override
    public MarketSeries load(String symbol, Instant fromInclusive, Instant toInclusive) {
        if (fromInclusive != null && toInclusive != null && fromInclusive.isAfter(toInclusive)) {
            throw new IllegalArgumentException("from must be <= to");
        }
        Predicate<Bar> inRange = bar -> (fromInclusive == null || !bar.timestamp().isBefore(fromInclusive))
                && (toInclusive == null || !bar.timestamp().isAfter(toInclusive));

        List<Bar> bars = readBars(symbol).stream().filter(inRange).toList();
        List<Bar> volatility = readBars(properties.volatilitySymbol()).stream().filter(inRange).toList();
        log.info("[MarketData][CSV] symbol={} bars={} volatilityBars={} from={} to={}",
                symbol, bars.size(), volatility.size(), fromInclusive, toInclusive);
        return new MarketSeries(symbol, bars, volatility);
    }

    @Override
    public MarketSeries loadLatest(String symbol, int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0");
        }
        List<Bar> all = readBars(symbol);
        List<Bar> bars = all.subList(Math.max(0, all.size() - count), all.size());
        Instant from = bars.isEmpty() ? null : bars.get(0).timestamp();
        List<Bar> volatility = readBars(properties.volatilitySymbol()).stream()
                .filter(bar -> from == null || !bar.timestamp().isBefore(from))
                .toList();
        return new MarketSeries(symbol, bars, volatility);
    }

    List<Bar> readBars(String symbol) {
        Path path = resolvePath(symbol);
        if (!Files.exists(path)) {
            log.warn("[MarketData][CSV] file missing path={}", path.toAbsolutePath());
            return List.of();
        }
        try {
            List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            List<Bar> out = new ArrayList<>(Math.max(0, lines.size() - 1));
            for (int i = 1; i < lines.size(); i++) {
                String line = lines.get(i).trim();
                if (line.isEmpty()) {
                    continue;
                }
                String[] parts = line.split(",", -1);
                if (parts.length < 6) {
                    throw new IllegalArgumentException("Malformed CSV row " + (i + 1) + " in " + path);
                }
                int row = i + 1;
                out.add(new Bar(
                        parseTs(parts[0]),
                        parseDouble(parts[1], row, path),
                        parseDouble(parts[2], row, path),
                        parseDouble(parts[3], row, path),
                        parseDouble(parts[4], row, path),
                        parseDouble(parts[5], row, path)
                ));
            }
            return out;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load CSV: " + path, e);
        }
    }

    private Path resolvePath(String symbol) {
        String safeSymbol = symbol.replaceAll("[^A-Za-z0-9._-]", "_");
        return Path.of(properties.csvDir(), safeSymbol + ".csv");
    }

    private Instant parseTs(String raw) {
        String value = raw.trim();
        if (value.length() == 10) {
            return LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        return Instant.parse(value);
    }

    private double parseDouble(String raw, int row, Path path) {
        String value = raw.trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Blank OHLCV field in CSV row " + row + " in " + path);
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Non-numeric OHLCV field in CSV row " + row + " in " + path, e);
        }
    }
}
