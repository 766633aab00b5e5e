package mattrack.tracker.monitor;

import mattrack.tracker.util.Debouncer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coalesces bursts of external triggers into one monitor cycle.
 * Different modes requested within one quiet period widen to {@link TriggerMode#FULL_CHECK}.
 */
public class CycleTrigger implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CycleTrigger.class);

    private final MonitorLoop loop;
    private final Debouncer debouncer;
    private TriggerMode pending;

    public CycleTrigger(MonitorLoop loop, Debouncer debouncer) {
        this.loop = loop;
        this.debouncer = debouncer;
    }

    public synchronized void trigger(TriggerMode mode) {
        pending = pending == null || pending == mode ? mode : TriggerMode.FULL_CHECK;
        log.debug("Monitor cycle requested ({}), pending {}", mode, pending);
        debouncer.submit(this::fire);
    }

    private void fire() {
        TriggerMode mode;
        synchronized (this) {
            mode = pending;
            pending = null;
        }
        if (mode != null) {
            loop.runCycle(mode);
        }
    }

    @Override
    public void close() {
        debouncer.close();
    }
}
