package mattrack.tracker.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.*;

/**
 * Collapses bursts of submissions into one run after a quiet period.
 */
public final class Debouncer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Debouncer.class);

    private final ScheduledExecutorService ses;
    private final long delayMs;
    private ScheduledFuture<?> future;

    public Debouncer(String name, long delayMs) {
        this.delayMs = delayMs;
        this.ses = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void submit(Runnable task) {
        if (future != null) future.cancel(false);
        future = ses.schedule(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Debounced task failed", e);
            }
        }, delayMs, TimeUnit.MILLISECONDS);
    }

    @Override public void close() { ses.shutdownNow(); }
}
