package org.nowstart.spxsignal.feature;

import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.nowstart.spxsignal.market.Bar;

/**
 * Finite, restartable sequence of {@link FeatureVector}s, one per bar in timestamp order.
 *
 * <p>Vectors are materialized on access from the precomputed indicator columns, so each
 * {@link #iterator()} call starts again from the first bar.
 */
public final class FeatureSeries implements Iterable<FeatureVector> {

    private final List<Bar> bars;
    private final Map<FeatureName, double[]> columns;

    FeatureSeries(List<Bar> bars, Map<FeatureName, double[]> columns) {
        this.bars = List.copyOf(bars);
        EnumMap<FeatureName, double[]> copy = new EnumMap<>(FeatureName.class);
        columns.forEach((name, values) -> {
            if (values.length != bars.size()) {
                throw new IllegalArgumentException("column " + name.key() + " length mismatch");
            }
            copy.put(name, values.clone());
        });
        this.columns = copy;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public List<Bar> bars() {
        return bars;
    }

    public Bar bar(int index) {
        return bars.get(index);
    }

    public FeatureVector get(int index) {
        if (index < 0 || index >= bars.size()) {
            throw new IndexOutOfBoundsException("index " + index + " outside [0, " + bars.size() + ")");
        }
        Map<FeatureName, Double> values = new EnumMap<>(FeatureName.class);
        columns.forEach((name, column) -> {
            double value = column[index];
            if (Double.isFinite(value)) {
                values.put(name, value);
            }
        });
        return new FeatureVector(bars.get(index).timestamp(), index, values);
    }

    public FeatureVector latest() {
        if (bars.isEmpty()) {
            throw new NoSuchElementException("feature series is empty");
        }
        return get(bars.size() - 1);
    }

    @Override
    public Iterator<FeatureVector> iterator() {
        return new Iterator<>() {
            private int cursor;

            @Override
            public boolean hasNext() {
                return cursor < bars.size();
            }

            @Override
            public FeatureVector next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return get(cursor++);
            }
        };
    }
}
