package com.trendscope.trending.engine;

import com.trendscope.observability.CorrelationContext;
import com.trendscope.observability.CorrelationContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Background loop that runs a refresh cycle, then waits one interval, until stopped.
 * <p>
 * The wait is on a stop latch, so {@link #stop()} ends it immediately; a cycle already in
 * progress is allowed to finish. Each cycle runs under its own correlation ID. Exceptions
 * from a cycle are logged and the loop carries on.
 */
final class RefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    static final String JOB_NAME = "refresh-loop";

    private final Runnable cycle;
    private final Duration interval;
    private final Object lock = new Object();

    private Thread worker;
    private CountDownLatch stopSignal;

    RefreshScheduler(Runnable cycle, Duration interval) {
        this.cycle = cycle;
        this.interval = interval;
    }

    /**
     * Starts the loop unless it is already running.
     *
     * @return true if a new loop was started
     */
    boolean start() {
        synchronized (lock) {
            if (worker != null && worker.isAlive()) {
                return false;
            }
            CountDownLatch signal = new CountDownLatch(1);
            Thread thread = new Thread(() -> loop(signal), "trending-" + JOB_NAME);
            thread.setDaemon(true);
            stopSignal = signal;
            worker = thread;
            thread.start();
            return true;
        }
    }

    /**
     * Signals the loop to stop and waits for it to exit. No-op when not running.
     */
    void stop() {
        synchronized (lock) {
            if (worker == null) {
                return;
            }
            stopSignal.countDown();
            if (worker != Thread.currentThread()) {
                try {
                    worker.join();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for the trending refresh loop to stop");
                    return;
                }
            }
            worker = null;
            stopSignal = null;
        }
    }

    boolean isRunning() {
        synchronized (lock) {
            return worker != null && worker.isAlive();
        }
    }

    private void loop(CountDownLatch signal) {
        log.info("Starting trending refresh loop (interval={}s)", interval.toSeconds());
        try {
            while (signal.getCount() > 0) {
                CorrelationContextHolder.runWithContext(CorrelationContext.forJob(JOB_NAME), this::runCycle);
                if (signal.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            log.info("Trending refresh loop stopped");
        }
    }

    private void runCycle() {
        try {
            cycle.run();
        } catch (RuntimeException e) {
            log.error("Trending refresh cycle failed", e);
        }
    }
}
