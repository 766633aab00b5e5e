package mattrack.tracker.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import mattrack.tracker.api.Controller;
import mattrack.tracker.api.internal.v1.dto.CallbackRequest;
import mattrack.tracker.api.internal.v1.dto.OperationResponse;
import mattrack.tracker.monitor.CycleTrigger;
import mattrack.tracker.monitor.TriggerMode;
import mattrack.tracker.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Controller for job-end callbacks (internal API).
 *
 * POST /internal/v1/callbacks - queue a monitor cycle; the body is optional
 */
public class CallbackController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(CallbackController.class);

    private static final String CALLBACKS_PATH = "/internal/v1/callbacks";

    private final CycleTrigger trigger;

    public CallbackController(CycleTrigger trigger) {
        this.trigger = trigger;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && CALLBACKS_PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String body = req.content().toString(StandardCharsets.UTF_8);
            TriggerMode mode = TriggerMode.COMPLETION;
            if (!body.isBlank()) {
                CallbackRequest request = RouterHandler.mapper().readValue(body, CallbackRequest.class);
                mode = request.triggerMode();
                log.debug("Callback for job {} ({})", request.jobId(), mode);
            }
            trigger.trigger(mode);
            return ControllerResponse.json(HttpResponseStatus.ACCEPTED,
                    RouterHandler.mapper().writeValueAsString(OperationResponse.success(mode.name().toLowerCase())));
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Callback controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
