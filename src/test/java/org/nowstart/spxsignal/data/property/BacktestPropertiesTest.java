package org.nowstart.spxsignal.data.property;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.nowstart.spxsignal.data.exception.InvalidConfigurationException;

class BacktestPropertiesTest {

    @Test
    void constructor_appliesDefaults() {
        BacktestProperties properties = new BacktestProperties(null, null, null, null, null, null, null, null, null);

        assertThat(properties.enabled()).isFalse();
        assertThat(properties.fromDt()).isEqualTo(Instant.parse("2015-01-01T00:00:00Z"));
        assertThat(properties.trainingRatio()).isEqualTo(0.7);
        assertThat(properties.sweepEnabled()).isTrue();
        assertThat(properties.topK()).isEqualTo(5);
        assertThat(properties.sweepParallelism()).isPositive();
        assertThat(properties.combinationCount()).isEqualTo(16L);
    }

    @Test
    void resolveStopLossValues_expandsInclusiveRange() {
        BacktestProperties properties = new BacktestProperties(null, null, null, null, null, " 0.3:0.6:0.1 ", null, null, null);

        assertThat(properties.resolveStopLossValues()).containsExactly(0.3, 0.4, 0.5, 0.6);
        assertThat(properties.resolveProfitTargetValues()).containsExactly(0.15, 0.25, 0.35, 0.45);
    }

    @Test
    void resolveStopLossValues_rejectsValuesAboveOne() {
        BacktestProperties properties = new BacktestProperties(null, null, null, null, null, "0.5:1.5:0.5", null, null, null);

        assertThatThrownBy(properties::resolveStopLossValues)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("sweep-stop-loss-range");
    }

    @Test
    void resolveProfitTargetValues_allowsTargetsAboveOne() {
        BacktestProperties properties = new BacktestProperties(null, null, null, null, null, null, "0.5:1.5:0.5", null, null);

        assertThat(properties.resolveProfitTargetValues()).containsExactly(0.5, 1.0, 1.5);
    }

    @Test
    void parseDoubleRange_rejectsMalformedSpecs() {
        assertThatThrownBy(() -> BacktestProperties.parseDoubleRange("0.3:0.6"))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> BacktestProperties.parseDoubleRange("0.3:0.6:0"))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> BacktestProperties.parseDoubleRange("0.6:0.3:0.1"))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> BacktestProperties.parseDoubleRange("a:b:c"))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void constructor_rejectsInvalidValues() {
        assertThatThrownBy(() -> new BacktestProperties(null, null, null, 1.0, null, null, null, null, null))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("training-ratio");
        assertThatThrownBy(() -> new BacktestProperties(null, Instant.parse("2024-01-02T00:00:00Z"),
                Instant.parse("2024-01-01T00:00:00Z"), null, null, null, null, null, null))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new BacktestProperties(null, null, null, null, null, null, null, 0, null))
                .isInstanceOf(InvalidConfigurationException.class);
    }
}
