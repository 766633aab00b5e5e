package mattrack.tracker.scheduler;

import mattrack.tracker.monitor.MonitorLoop;
import mattrack.tracker.monitor.TriggerMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs a FULL_CHECK monitor cycle periodically.
 *
 * Uses a single-threaded executor; cycles triggered from elsewhere are serialized by the loop itself.
 */
public class MonitorScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MonitorScheduler.class);

    private final ScheduledExecutorService executor;
    private final MonitorLoop loop;
    private final Duration interval;

    private volatile boolean running = false;

    /**
     * @param loop     monitor loop to drive
     * @param interval time between cycles
     */
    public MonitorScheduler(MonitorLoop loop, Duration interval) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mattrack-monitor");
            t.setDaemon(true);
            return t;
        });
        this.loop = loop;
        this.interval = interval;
    }

    public void start() {
        if (running) {
            log.warn("Monitor scheduler already running");
            return;
        }

        running = true;

        long intervalMs = interval.toMillis();
        executor.scheduleWithFixedDelay(
                wrapRunnable("monitor-cycle", () -> loop.runCycle(TriggerMode.FULL_CHECK)),
                0,
                intervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Monitor cycle scheduled every {}ms", intervalMs);
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Monitor scheduler forcefully stopped");
            } else {
                log.info("Monitor scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Wrap a runnable with error handling; an exception must not cancel the periodic schedule.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
