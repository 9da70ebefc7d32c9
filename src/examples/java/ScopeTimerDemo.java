/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

import org.TimingUtils.ScopeTimer;
import org.TimingUtils.Ticker;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * A simple demonstration of using ScopeTimer and Ticker objects to time nested and repeated
 * steps of a fictitious job, and report on them.
 */
public class ScopeTimerDemo {
    static final Random random = new Random();

    static void work(long msec) throws InterruptedException {
        TimeUnit.MILLISECONDS.sleep(msec);
    }

    public static void main(final String[] args) throws InterruptedException {
        ScopeTimer root = new ScopeTimer("root");

        try (ScopeTimer r = root.enter()) {
            // The same child is reused on each iteration, accumulating one interval per pass:
            for (int i = 0; i < 5; i++) {
                try (ScopeTimer task1 = root.getOrCreateChild("task1", 5).enter()) {
                    work(10);
                    try (ScopeTimer subtask = task1.getOrCreateChild("subtask1_1").enter()) {
                        work(30);
                    }
                    try (ScopeTimer subtask = task1.getOrCreateChild("subtask1_2").enter()) {
                        work(70);
                    }
                }
            }
            try (ScopeTimer task2 = root.getOrCreateChild("task2").enter()) {
                work(170);
            }
        }
        System.out.println(root);

        Ticker ticker = new Ticker(20);
        for (int i = 0; i < 20; i++) {
            ticker.mark();
            work(random.nextInt(100));
        }
        System.out.println(ticker);
        System.out.println("Frequency: " + ticker.getFrequency() + " Hz\n");
        ticker.outputPercentileDistribution(System.out);
    }
}
