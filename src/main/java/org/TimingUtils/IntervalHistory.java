/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.TimingUtils;

/**
 * A bounded history of interval samples (in seconds). Samples are kept in a fixed size ring: once
 * the history holds {@code capacity} samples, each new append evicts the oldest one. Retained samples
 * are always kept in the order in which they were appended.
 * <p>
 * Statistics are computed over the retained samples only. An empty history reports 0.0 for all of its
 * statistics rather than failing, as an incomplete history is an expected transient state.
 * <p>
 * IntervalHistory is not thread safe. Concurrent appends to the same instance are not supported.
 */
public class IntervalHistory {
    private final double samples[];
    private final int capacity;
    private long count = 0;

    /**
     * @param capacity The maximum number of samples to retain. Must be positive.
     */
    public IntervalHistory(final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
        this.samples = new double[capacity];
    }

    /**
     * Append a sample, evicting the oldest retained sample if the history is full.
     * @param value the interval (in seconds) to append. Not validated.
     */
    public void append(double value) {
        int positionToSwap = (int) (count % capacity);
        samples[positionToSwap] = value;
        count++;
    }

    /**
     * @return the number of currently retained samples
     */
    public int size() {
        return (int) Math.min(count, capacity);
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * @return the number of samples ever appended, including evicted ones
     */
    public long getTotalAppended() {
        return count;
    }

    /**
     * Get a retained sample by age.
     * @param index 0 for the oldest retained sample, {@code size() - 1} for the latest one
     * @return the sample at that position
     */
    public double get(int index) {
        if ((index < 0) || (index >= size())) {
            throw new IndexOutOfBoundsException("index " + index + " out of range for history of size " + size());
        }
        return samples[(int) ((getEarliestPosition() + index) % capacity)];
    }

    /**
     * @return a copy of the retained samples, oldest first
     */
    public double[] toArray() {
        final int size = size();
        final double copy[] = new double[size];
        for (int i = 0; i < size; i++) {
            copy[i] = get(i);
        }
        return copy;
    }

    public double getMin() {
        if (isEmpty()) {
            return 0.0;
        }
        double min = Double.POSITIVE_INFINITY;
        for (int i = 0; i < size(); i++) {
            min = Math.min(min, get(i));
        }
        return min;
    }

    public double getMax() {
        if (isEmpty()) {
            return 0.0;
        }
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < size(); i++) {
            max = Math.max(max, get(i));
        }
        return max;
    }

    public double getMean() {
        if (isEmpty()) {
            return 0.0;
        }
        final int size = size();
        double sum = 0.0;
        for (int i = 0; i < size; i++) {
            sum += get(i);
        }
        return sum / size;
    }

    /**
     * @return the mean frequency (in Hertz) of the retained intervals, or 0.0 if the mean is not positive
     */
    public double getFrequency() {
        double mean = getMean();
        return (mean > 0) ? 1 / mean : 0.0;
    }

    private long getEarliestPosition() {
        // Before the ring wraps the oldest sample sits at 0, after that it is the next one to be overwritten:
        return (count <= capacity) ? 0 : (count % capacity);
    }
}
