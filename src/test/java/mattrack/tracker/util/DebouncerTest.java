package mattrack.tracker.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DebouncerTest {

    @Test
    void burstCollapsesIntoOneRun() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(1);
        try (Debouncer debouncer = new Debouncer("test-debounce", 100)) {
            for (int i = 0; i < 10; i++) {
                debouncer.submit(() -> {
                    runs.incrementAndGet();
                    done.countDown();
                });
            }
            assertTrue(done.await(5, TimeUnit.SECONDS));
            Thread.sleep(300);
        }
        assertEquals(1, runs.get());
    }

    @Test
    void failingTaskDoesNotStopLaterRuns() throws Exception {
        CountDownLatch done = new CountDownLatch(1);
        try (Debouncer debouncer = new Debouncer("test-debounce", 20)) {
            debouncer.submit(() -> {
                throw new IllegalStateException("boom");
            });
            Thread.sleep(200);
            debouncer.submit(done::countDown);
            assertTrue(done.await(5, TimeUnit.SECONDS));
        }
    }
}
