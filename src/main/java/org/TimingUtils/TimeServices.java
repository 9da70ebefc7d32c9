/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.TimingUtils;

import java.util.concurrent.TimeUnit;

/**
 * Provide the monotonic clock used by all timers in this package. By default, time is provided
 * by the JDK's System.nanoTime(). However, if the property TimingUtils.useActualTime is set to
 * "false", TimeServices will only move the notion of time in response to calls to the
 * {@link #setCurrentTime}, {@link #moveTimeForward} and {@link #moveTimeForwardMsec} methods.
 * <p>
 * Artificial time is a test facility: it makes measured intervals (and therefore rendered
 * timer trees) exactly reproducible.
 */
public class TimeServices {
    static final boolean useActualTime;

    static final double NANOS_PER_SECOND = 1000000000.0;

    static volatile long currentTime;

    static {
        String useActualTimeProperty = System.getProperty("TimingUtils.useActualTime", "true");
        useActualTime = !useActualTimeProperty.equals("false");
    }

    public static long nanoTime() {
        if (useActualTime) {
            return System.nanoTime();
        }
        return currentTime;
    }

    /**
     * Convert a difference between two {@link #nanoTime()} readings to seconds, the unit in which
     * all intervals are recorded.
     * @param nanos a time delta in nanoseconds
     * @return the same delta in seconds
     */
    public static double nanosToSeconds(long nanos) {
        return nanos / NANOS_PER_SECOND;
    }

    public static void moveTimeForward(long timeDeltaNsec) throws InterruptedException {
        if (timeDeltaNsec < 0) {
            throw new IllegalStateException("Can't move time backwards.");
        }
        setCurrentTime(nanoTime() + timeDeltaNsec);
    }

    public static void moveTimeForwardMsec(long timeDeltaMsec) throws InterruptedException {
        moveTimeForward(timeDeltaMsec * 1000000L);
    }

    /**
     * With actual time, wait until the clock reaches {@code newCurrentTime} (returning immediately if it
     * already has). With artificial time, set the clock to {@code newCurrentTime}.
     * @param newCurrentTime the time (in nanoTime units) to move to
     * @throws InterruptedException if interrupted while waiting for actual time to pass
     * @throws IllegalStateException if artificial time would move into the past
     */
    public static void setCurrentTime(long newCurrentTime) throws InterruptedException {
        if (useActualTime) {
            for (long remaining = newCurrentTime - System.nanoTime();
                 remaining > 0;
                 remaining = newCurrentTime - System.nanoTime()) {
                TimeUnit.NANOSECONDS.sleep(remaining);
            }
            return;
        }
        if (newCurrentTime < currentTime) {
            throw new IllegalStateException("Can't set current time to the past.");
        }
        currentTime = newCurrentTime;
    }
}
