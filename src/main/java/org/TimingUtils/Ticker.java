/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.TimingUtils;

/**
 * A Ticker measures the time interval between repeatedly occurring events. Each call to {@link #mark()}
 * records the time elapsed since the previous call. The first call only establishes a baseline, so after
 * K marks the ticker has recorded K - 1 intervals (of which the latest {@code capacity} are retained).
 * <p>
 * Example usage:
 * <pre>
 * Ticker ticker = new Ticker(5);
 * for (int i = 0; i &lt; 10; i++) {
 *     ticker.mark();
 *     doSomeWork();
 * }
 * System.out.println(ticker);
 * </pre>
 * prints something like
 * <pre>
 * &lt;Ticker intervals=[0.0899, 0.0632, 0.0543, 0.0713, 0.0681] min=0.0543 mean=0.0694 max=0.0899&gt;
 * </pre>
 * A Ticker is always armed; there is nothing to stop. It is not thread safe: a single Ticker must not be
 * marked from multiple threads concurrently.
 */
public class Ticker extends IntervalRecorder {
    private long lastMarkTime;
    private boolean marked = false;

    /**
     * Create a Ticker retaining the default number of intervals (10).
     */
    public Ticker() {
        this(DEFAULT_Capacity);
    }

    /**
     * @param capacity The maximum number of intervals to retain. Must be positive.
     */
    public Ticker(final int capacity) {
        super(Kind.TICKER, capacity);
    }

    /**
     * Register an event occurrence in this Ticker.
     */
    public void mark() {
        long now = TimeServices.nanoTime();
        if (marked) {
            recordInterval(TimeServices.nanosToSeconds(now - lastMarkTime));
        }
        lastMarkTime = now;
        marked = true;
    }

    /**
     * @return true if {@link #mark()} was called at least once
     */
    public boolean hasMarked() {
        return marked;
    }
}
