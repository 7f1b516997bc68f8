package org.nowstart.spxsignal.feature;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import org.nowstart.spxsignal.data.exception.InsufficientHistoryException;

/**
 * Indicator values for one bar. Only available values are stored; a missing key means the indicator
 * had too little history at {@link #timestamp()} and must be treated as missing, never as zero.
 */
public final class FeatureVector {

    private final Instant timestamp;
    private final int index;
    private final Map<FeatureName, Double> values;

    public FeatureVector(Instant timestamp, int index, Map<FeatureName, Double> values) {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp is required");
        }
        this.timestamp = timestamp;
        this.index = index;
        EnumMap<FeatureName, Double> copy = new EnumMap<>(FeatureName.class);
        if (values != null) {
            values.forEach((name, value) -> {
                if (value != null && Double.isFinite(value)) {
                    copy.put(name, value);
                }
            });
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public Instant timestamp() {
        return timestamp;
    }

    /**
     * Position of the source bar within its series.
     */
    public int index() {
        return index;
    }

    public boolean isAvailable(FeatureName name) {
        return values.containsKey(name);
    }

    public OptionalDouble get(FeatureName name) {
        Double value = values.get(name);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public double require(FeatureName name) {
        Double value = values.get(name);
        if (value == null) {
            throw new InsufficientHistoryException(
                    "feature-engine",
                    timestamp,
                    "Feature " + name.key() + " unavailable at " + timestamp
            );
        }
        return value;
    }

    /**
     * Key/value view using the stable feature keys, in declaration order.
     */
    public Map<String, Double> asKeyedMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        values.forEach((name, value) -> out.put(name.key(), value));
        return out;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        FeatureVector that = (FeatureVector) other;
        return index == that.index && timestamp.equals(that.timestamp) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * timestamp.hashCode() + index) + values.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureVector{timestamp=" + timestamp + ", index=" + index + ", values=" + values.size() + "}";
    }
}
