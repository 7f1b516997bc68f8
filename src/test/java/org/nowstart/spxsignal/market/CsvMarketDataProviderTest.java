package org.nowstart.spxsignal.market;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nowstart.spxsignal.data.exception.NonMonotonicTimeSeriesException;
import org.nowstart.spxsignal.data.property.MarketDataProperties;

class CsvMarketDataProviderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_filtersRangeAndAttachesVolatilityBars() throws IOException {
        write("SPX.csv",
                "2024-01-02,4700,4720,4690,4710,1000",
                "2024-01-03,4710,4730,4700,4725,1100",
                "2024-01-04,4725,4740,4715,4730,1200");
        write("VIX.csv",
                "2024-01-02,13,14,12,13.5,0",
                "2024-01-03,13.5,14,13,13.8,0");
        CsvMarketDataProvider provider = provider();

        MarketSeries series = provider.load("SPX",
                Instant.parse("2024-01-03T00:00:00Z"), Instant.parse("2024-01-04T00:00:00Z"));

        assertThat(series.bars()).extracting(Bar::close).containsExactly(4725.0, 4730.0);
        assertThat(series.volatilityBars()).extracting(Bar::close).containsExactly(13.8);
    }

    @Test
    void load_acceptsIsoInstants() throws IOException {
        write("SPX.csv", "2024-01-02T14:30:00Z,1,2,0.5,1.5,10");

        MarketSeries series = provider().load("SPX", null, null);

        assertThat(series.bars().get(0).timestamp()).isEqualTo(Instant.parse("2024-01-02T14:30:00Z"));
    }

    @Test
    void load_missingFileYieldsEmptySeries() {
        MarketSeries series = provider().load("SPX", null, null);

        assertThat(series.isEmpty()).isTrue();
        assertThat(series.volatilityBars()).isEmpty();
    }

    @Test
    void load_rejectsOutOfOrderRows() throws IOException {
        write("SPX.csv",
                "2024-01-03,1,1,1,1,1",
                "2024-01-02,1,1,1,1,1");

        assertThatThrownBy(() -> provider().load("SPX", null, null))
                .isInstanceOf(NonMonotonicTimeSeriesException.class);
    }

    @Test
    void readBars_rejectsShortRows() throws IOException {
        write("SPX.csv", "2024-01-02,1,2,3");

        assertThatThrownBy(() -> provider().readBars("SPX"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed CSV row 2");
    }

    @Test
    void readBars_rejectsBlankPriceField() throws IOException {
        write("SPX.csv",
                "2024-01-02,1,1,1,1,1",
                "2024-01-03,2,2,,2,1");

        assertThatThrownBy(() -> provider().readBars("SPX"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Blank OHLCV field in CSV row 3");
    }

    @Test
    void readBars_rejectsNonNumericField() throws IOException {
        write("SPX.csv", "2024-01-02,1,1,1,n/a,1");

        assertThatThrownBy(() -> provider().readBars("SPX"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("CSV row 2");
    }

    @Test
    void loadLatest_returnsTail() throws IOException {
        write("SPX.csv",
                "2024-01-02,1,1,1,1,1",
                "2024-01-03,2,2,2,2,1",
                "2024-01-04,3,3,3,3,1");

        MarketSeries series = provider().loadLatest("SPX", 2);

        assertThat(series.bars()).extracting(Bar::close).containsExactly(2.0, 3.0);
    }

    private CsvMarketDataProvider provider() {
        return new CsvMarketDataProvider(new MarketDataProperties(tempDir.toString(), "SPX", "VIX", 300));
    }

    private void write(String fileName, String... rows) throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add(CsvMarketDataProvider.CSV_HEADER);
        lines.addAll(List.of(rows));
        Files.write(tempDir.resolve(fileName), lines);
    }
}
