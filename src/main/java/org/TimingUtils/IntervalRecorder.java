/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.TimingUtils;

import org.HdrHistogram.DoubleHistogram;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * IntervalRecorder is the common base of {@link Ticker} and {@link ScopeTimer}. It records measured
 * time intervals (in seconds) into a bounded {@link IntervalHistory}, from which min, mean, max and
 * frequency statistics are derived.
 * <p>
 * In addition to the bounded history, every recorded interval is also tracked in an accumulated
 * {@link org.HdrHistogram.DoubleHistogram}, which is never evicted. The accumulated histogram can be
 * used to examine the percentile distribution of all intervals recorded over the recorder's lifetime
 * (see {@link #getAccumulatedHistogram} and {@link #outputPercentileDistribution}).
 */
public abstract class IntervalRecorder {

    /**
     * The kind of a recorder, carrying the type name used when rendering it.
     */
    public enum Kind {
        TICKER("Ticker"),
        SCOPE_TIMER("ScopeTimer");

        private final String typeName;

        Kind(String typeName) {
            this.typeName = typeName;
        }

        public String getTypeName() {
            return typeName;
        }
    }

    static final int DEFAULT_Capacity = 10;
    static final int MAX_RENDERED_INTERVALS = 5;
    static final int numberOfSignificantValueDigits = 2;

    private final Kind kind;
    private final IntervalHistory intervalHistory;
    private final DoubleHistogram accumulatedHistogram;

    /**
     * @param kind The kind of this recorder
     * @param capacity The maximum number of intervals retained in the interval history. Must be positive.
     */
    protected IntervalRecorder(final Kind kind, final int capacity) {
        this.kind = kind;
        this.intervalHistory = new IntervalHistory(capacity);
        this.accumulatedHistogram = new DoubleHistogram(numberOfSignificantValueDigits);
    }

    void recordInterval(double intervalSeconds) {
        intervalHistory.append(intervalSeconds);
        accumulatedHistogram.recordValue(intervalSeconds);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the bounded history of intervals recorded by this recorder
     */
    public IntervalHistory getIntervalHistory() {
        return intervalHistory;
    }

    public int getCapacity() {
        return intervalHistory.getCapacity();
    }

    /**
     * @return the shortest retained interval (in seconds), or 0.0 if none was recorded
     */
    public double getMin() {
        return intervalHistory.getMin();
    }

    /**
     * @return the mean of the retained intervals (in seconds), or 0.0 if none was recorded
     */
    public double getMean() {
        return intervalHistory.getMean();
    }

    /**
     * @return the longest retained interval (in seconds), or 0.0 if none was recorded
     */
    public double getMax() {
        return intervalHistory.getMax();
    }

    /**
     * @return the mean frequency (in Hertz) of the retained intervals, or 0.0 if not known
     */
    public double getFrequency() {
        return intervalHistory.getFrequency();
    }

    /**
     * @return the number of intervals recorded over the lifetime of this recorder, including those no
     * longer retained in the interval history
     */
    public long getTotalCount() {
        return accumulatedHistogram.getTotalCount();
    }

    /**
     * Get a copy of the accumulated histogram of all intervals (in seconds) recorded by this recorder.
     *
     * @return a copy of the accumulated interval histogram
     */
    public DoubleHistogram getAccumulatedHistogram() {
        return accumulatedHistogram.copy();
    }

    /**
     * Print the percentile distribution of all intervals recorded by this recorder, in seconds.
     *
     * @param printStream the stream to print to
     */
    public void outputPercentileDistribution(PrintStream printStream) {
        accumulatedHistogram.outputPercentileDistribution(printStream, 1.0);
    }

    /**
     * Render this recorder (and, for a {@link ScopeTimer}, its subtree) as text.
     *
     * @return the textual rendering
     */
    public String render() {
        return "<" + String.join(" ", renderedProperties()) + ">";
    }

    @Override
    public String toString() {
        return render();
    }

    /**
     * @return the space separated elements of this recorder's rendering, starting with its type name
     */
    List<String> renderedProperties() {
        List<String> properties = new ArrayList<String>();
        properties.add(kind.getTypeName());
        addIdentityProperties(properties);
        if (!intervalHistory.isEmpty()) {
            int size = intervalHistory.size();
            List<String> intervals = new ArrayList<String>();
            for (int i = 0; i < Math.min(size, MAX_RENDERED_INTERVALS); i++) {
                intervals.add(formatSeconds(intervalHistory.get(i)));
            }
            if (size > MAX_RENDERED_INTERVALS) {
                intervals.add("...");
            }
            properties.add("intervals=[" + String.join(", ", intervals) + "]");
            properties.add("min=" + formatSeconds(getMin()));
            properties.add("mean=" + formatSeconds(getMean()));
            properties.add("max=" + formatSeconds(getMax()));
        }
        return properties;
    }

    /**
     * Hook for subclasses to add rendered properties that precede the interval statistics.
     */
    void addIdentityProperties(List<String> properties) {
    }

    static String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.4f", seconds);
    }
}
