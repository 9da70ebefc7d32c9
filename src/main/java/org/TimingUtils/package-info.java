/*
 * package-info.java
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

/**
 * <h3>A hierarchical timing package</h3>
 * <p>
 * The TimingUtils package includes simple utilities for timing in-process code, and for reporting on the
 * observed timings in a readable, hierarchical form.
 * <p>
 * Two kinds of interval recorders are provided:
 * <li>{@link org.TimingUtils.Ticker} measures the interval between successive occurrences of a repeating
 * event, e.g. the iterations of a processing loop.</li>
 * <li>{@link org.TimingUtils.ScopeTimer} measures the time spent in bracketed regions of code. ScopeTimers
 * form a tree of named timers, so that nested and serial steps of an operation can each be timed, and
 * repeated use of the same named step accumulates intervals in the same timer.</li>
 * <p>
 * Both keep a bounded {@link org.TimingUtils.IntervalHistory} of the latest intervals from which min, mean,
 * max and frequency statistics are derived, as well as an accumulated HdrHistogram of all intervals ever
 * recorded (see {@link org.TimingUtils.IntervalRecorder}).
 * <p>
 * All intervals are measured with a monotonic clock (see {@link org.TimingUtils.TimeServices}) and are
 * expressed in seconds. None of the recorders are thread safe.
 */

package org.TimingUtils;
