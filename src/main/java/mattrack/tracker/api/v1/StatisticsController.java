package mattrack.tracker.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import mattrack.tracker.api.Controller;
import mattrack.tracker.server.RouterHandler;
import mattrack.tracker.service.StatisticsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GET /api/v1/statistics - store-wide counts
 */
public class StatisticsController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(StatisticsController.class);

    private final StatisticsService statisticsService;

    public StatisticsController(StatisticsService statisticsService) {
        this.statisticsService = statisticsService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/statistics".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(statisticsService.statistics()));
        } catch (Exception e) {
            log.error("Statistics controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
