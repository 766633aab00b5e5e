package mattrack.tracker.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import mattrack.tracker.api.Controller;
import mattrack.tracker.api.v1.dto.HealthResponse;
import mattrack.tracker.model.CalculationStatus;
import mattrack.tracker.repository.CalculationRepository;
import mattrack.tracker.server.RouterHandler;
import mattrack.tracker.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final CalculationRepository calculations;
    private final BooleanSupplier monitorRunning;

    public HealthController(Database database, CalculationRepository calculations, BooleanSupplier monitorRunning) {
        this.database = database;
        this.calculations = calculations;
        this.monitorRunning = monitorRunning;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return unavailable("connection failed");
            }

            int pending = calculations.countByStatus(CalculationStatus.PENDING)
                    + calculations.countByStatus(CalculationStatus.RESUBMITTED);
            int active = calculations.countByStatus(CalculationStatus.SUBMITTED)
                    + calculations.countByStatus(CalculationStatus.RUNNING);

            HealthResponse response = HealthResponse.healthy(formatUptime(), VERSION, pending, active,
                    monitorRunning.getAsBoolean());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return unavailable(e.getMessage());
        }
    }

    private ControllerResponse unavailable(String reason) {
        try {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(reason)));
        } catch (Exception e) {
            return ControllerResponse.error("health check failed");
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
