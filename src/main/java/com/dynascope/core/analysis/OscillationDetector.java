package com.dynascope.core.analysis;

import java.util.HashMap;
import java.util.Map;

/**
 * Bounded trailing windows of signed samples, one per key, with the sign-change
 * count kept incrementally so frequency checks cost O(1) per sample.
 * <p>
 * Not thread-safe; each analysis owns its own instance.
 */
final class OscillationDetector<K> {

    private final int capacity;
    private final Map<K, Window> windows = new HashMap<>();

    OscillationDetector(int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("window capacity must be at least 2, was " + capacity);
        }
        this.capacity = capacity;
    }

    void record(K key, double time, double value) {
        windows.computeIfAbsent(key, k -> new Window(capacity)).add(time, value);
    }

    int sampleCount(K key) {
        Window window = windows.get(key);
        return window != null ? window.size : 0;
    }

    boolean isFull(K key) {
        return sampleCount(key) == capacity;
    }

    /** Sign changes per unit time halved: one full period crosses zero twice. */
    double zeroCrossingFrequency(K key) {
        Window window = windows.get(key);
        if (window == null || window.size < 2) {
            return 0.0;
        }
        double span = window.newestTime() - window.times[window.head];
        return span > 0.0 ? window.crossings / (2.0 * span) : 0.0;
    }

    /** Fraction of consecutive sample pairs whose sign differs. */
    double alternationRatio(K key) {
        Window window = windows.get(key);
        if (window == null || window.size < 2) {
            return 0.0;
        }
        return (double) window.crossings / (window.size - 1);
    }

    /** Mean magnitude of the later half of the window over that of the earlier half. */
    double decayRatio(K key) {
        Window window = windows.get(key);
        if (window == null || window.size < 2) {
            return 0.0;
        }
        int half = window.size / 2;
        double early = 0.0;
        double late = 0.0;
        for (int i = 0; i < half; i++) {
            early += Math.abs(window.valueAt(i));
            late += Math.abs(window.valueAt(window.size - half + i));
        }
        return early > 0.0 ? late / early : 0.0;
    }

    double meanMagnitude(K key) {
        Window window = windows.get(key);
        if (window == null || window.size == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = 0; i < window.size; i++) {
            sum += Math.abs(window.valueAt(i));
        }
        return sum / window.size;
    }

    void clearHistory(K key) {
        windows.remove(key);
    }

    private static final class Window {

        final double[] times;
        final double[] values;
        final boolean[] crossed;
        int head;
        int size;
        int crossings;
        int lastSign;

        Window(int capacity) {
            times = new double[capacity];
            values = new double[capacity];
            crossed = new boolean[capacity];
        }

        void add(double time, double value) {
            int sign = value > 0.0 ? 1 : value < 0.0 ? -1 : lastSign;
            boolean crossing = size > 0 && lastSign != 0 && sign != 0 && sign != lastSign;
            if (size == times.length) {
                head = (head + 1) % times.length;
                size--;
                // the new oldest sample no longer has a predecessor in the window
                if (crossed[head]) {
                    crossings--;
                }
            }
            int slot = (head + size) % times.length;
            times[slot] = time;
            values[slot] = value;
            crossed[slot] = crossing;
            if (crossing) {
                crossings++;
            }
            lastSign = sign;
            size++;
        }

        double valueAt(int offset) {
            return values[(head + offset) % values.length];
        }

        double newestTime() {
            return times[(head + size - 1) % times.length];
        }
    }
}
