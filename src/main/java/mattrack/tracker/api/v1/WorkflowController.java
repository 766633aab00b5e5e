package mattrack.tracker.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import mattrack.tracker.api.Controller;
import mattrack.tracker.api.internal.v1.dto.OperationResponse;
import mattrack.tracker.server.RouterHandler;
import mattrack.tracker.workflow.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for material workflows (public API).
 *
 * GET /api/v1/materials/{materialId}/workflow - Progress summary
 * POST /api/v1/materials/{materialId}/workflow/pause - Stop generating follow-up calculations
 * POST /api/v1/materials/{materialId}/workflow/resume - Resume a paused workflow
 */
public class WorkflowController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    private static final Pattern STATUS_PATTERN = Pattern.compile("^/api/v1/materials/([^/]+)/workflow$");
    private static final Pattern ACTION_PATTERN =
            Pattern.compile("^/api/v1/materials/([^/]+)/workflow/(pause|resume)$");

    private final WorkflowEngine workflowEngine;

    public WorkflowController(WorkflowEngine workflowEngine) {
        this.workflowEngine = workflowEngine;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return STATUS_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.POST) && ACTION_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher statusMatcher = STATUS_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.GET) && statusMatcher.matches()) {
                return ControllerResponse.json(RouterHandler.mapper()
                        .writeValueAsString(workflowEngine.workflowStatus(statusMatcher.group(1))));
            }

            Matcher actionMatcher = ACTION_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.POST) && actionMatcher.matches()) {
                String materialId = actionMatcher.group(1);
                boolean changed = "pause".equals(actionMatcher.group(2))
                        ? workflowEngine.pause(materialId)
                        : workflowEngine.resume(materialId);
                if (!changed) {
                    return ControllerResponse.json(HttpResponseStatus.CONFLICT, RouterHandler.mapper()
                            .writeValueAsString(OperationResponse.error("no_matching_workflow")));
                }
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));
            }

            return ControllerResponse.notFound("unknown workflow endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Workflow controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
