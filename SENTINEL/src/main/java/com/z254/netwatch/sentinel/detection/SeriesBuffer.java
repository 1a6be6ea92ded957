package com.z254.netwatch.sentinel.detection;

import java.util.Arrays;

/**
 * Fixed-capacity ring buffer of observations for one series.
 * <p>
 * Appending to a full buffer overwrites the oldest value; appends never block.
 * Not thread-safe: owned by a single {@link SeriesDiscordDetector}.
 */
public class SeriesBuffer {

    private final double[] values;
    private int head;
    private int size;

    public SeriesBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.values = new double[capacity];
    }

    public void append(double value) {
        values[head] = value;
        head = (head + 1) % values.length;
        if (size < values.length) {
            size++;
        }
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return values.length;
    }

    public boolean isFull() {
        return size == values.length;
    }

    /**
     * Copy of the buffered values, oldest first.
     */
    public double[] toArray() {
        double[] out = new double[size];
        int start = (head - size + values.length) % values.length;
        for (int i = 0; i < size; i++) {
            out[i] = values[(start + i) % values.length];
        }
        return out;
    }

    /**
     * Most recent value; {@code NaN} when empty.
     */
    public double latest() {
        if (size == 0) {
            return Double.NaN;
        }
        return values[(head - 1 + values.length) % values.length];
    }

    public void clear() {
        Arrays.fill(values, 0.0);
        head = 0;
        size = 0;
    }
}
