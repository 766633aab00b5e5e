package mattrack;

import mattrack.tracker.config.Dependencies;
import mattrack.tracker.config.TrackerConfig;
import mattrack.tracker.server.TrackerHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Tracker entry point.
 *
 * Starts the HTTP server, then the periodic monitor, and blocks until the JVM is asked to stop.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        TrackerConfig config = TrackerConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        TrackerHttpServer server = new TrackerHttpServer(deps.routerHandler());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down mattrack...");
            server.close();
            deps.close();
            stopped.countDown();
        }, "mattrack-shutdown"));

        try {
            int port = server.start(config.serverHost(), config.serverPort());
            log.info("mattrack listening on {}:{}", config.serverHost(), port);
        } catch (Exception e) {
            log.error("Failed to start HTTP server", e);
            System.exit(1);
        }

        deps.startMonitor();
        stopped.await();
    }
}
