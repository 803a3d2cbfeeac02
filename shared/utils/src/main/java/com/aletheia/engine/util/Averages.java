package com.aletheia.engine.util;

import java.util.Collection;
import java.util.function.ToDoubleFunction;

/**
 * Arithmetic mean helpers. An empty input has no mean; callers pick the fallback.
 */
public final class Averages {

    private Averages() {
    }

    public static <T> double mean(Collection<? extends T> items, ToDoubleFunction<? super T> value, double ifEmpty) {
        if (items == null || items.isEmpty()) {
            return ifEmpty;
        }
        double sum = 0;
        for (T item : items) {
            sum += value.applyAsDouble(item);
        }
        return sum / items.size();
    }

    public static double mean(Collection<? extends Number> values, double ifEmpty) {
        return mean(values, Number::doubleValue, ifEmpty);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
