package mattrack.tracker.scheduler;

import mattrack.tracker.config.TrackerConfig;
import mattrack.tracker.monitor.CycleReport;
import mattrack.tracker.monitor.MonitorLoop;
import mattrack.tracker.monitor.TriggerMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MonitorSchedulerTest {

    private static final class CountingLoop extends MonitorLoop {
        final List<TriggerMode> modes = new CopyOnWriteArrayList<>();
        final CountDownLatch cycles = new CountDownLatch(3);

        CountingLoop() {
            super(null, null, null, null, null, null, null, null, null, null, TrackerConfig.defaults());
        }

        @Override
        public synchronized CycleReport runCycle(TriggerMode mode) {
            modes.add(mode);
            cycles.countDown();
            if (modes.size() == 1) {
                throw new IllegalStateException("first cycle fails");
            }
            return new CycleReport(mode, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
        }
    }

    @Test
    void runsFullChecksPeriodicallyAndSurvivesFailures() throws Exception {
        CountingLoop loop = new CountingLoop();
        try (MonitorScheduler scheduler = new MonitorScheduler(loop, Duration.ofMillis(20))) {
            scheduler.start();
            scheduler.start();
            assertTrue(scheduler.isRunning());

            assertTrue(loop.cycles.await(5, TimeUnit.SECONDS));
            scheduler.stop();
            assertFalse(scheduler.isRunning());
        }
        assertTrue(loop.modes.stream().allMatch(m -> m == TriggerMode.FULL_CHECK));
    }
}
