package mattrack.tracker.api.v1;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import mattrack.tracker.api.Controller;
import mattrack.tracker.api.internal.v1.dto.OperationResponse;
import mattrack.tracker.api.v1.dto.CalculationResponse;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationKind;
import mattrack.tracker.model.CalculationStatus;
import mattrack.tracker.model.IllegalTransitionException;
import mattrack.tracker.model.TransitionResult;
import mattrack.tracker.server.RouterHandler;
import mattrack.tracker.service.CalculationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for calculations (public API).
 *
 * GET /api/v1/calculations?status=&kind=&material=&limit= - List calculations
 * GET /api/v1/calculations/{calcId} - Get one calculation
 * POST /api/v1/calculations/{calcId}/cancel - Cancel a calculation
 */
public class CalculationController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(CalculationController.class);

    private static final Pattern LIST_PATTERN = Pattern.compile("^/api/v1/calculations$");
    private static final Pattern BY_ID_PATTERN = Pattern.compile("^/api/v1/calculations/([^/]+)$");
    private static final Pattern CANCEL_PATTERN = Pattern.compile("^/api/v1/calculations/([^/]+)/cancel$");

    private static final int DEFAULT_LIMIT = 100;
    private static final int MAX_LIMIT = 1000;

    private final CalculationService calculationService;

    public CalculationController(CalculationService calculationService) {
        this.calculationService = calculationService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return LIST_PATTERN.matcher(path).matches() || BY_ID_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.POST) && CANCEL_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.GET) && LIST_PATTERN.matcher(path).matches()) {
                return handleList(new QueryStringDecoder(req.uri()).parameters());
            }

            Matcher cancelMatcher = CANCEL_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.POST) && cancelMatcher.matches()) {
                return handleCancel(cancelMatcher.group(1), req);
            }

            Matcher byIdMatcher = BY_ID_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.GET) && byIdMatcher.matches()) {
                return handleGet(byIdMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown calculation endpoint");

        } catch (IllegalTransitionException e) {
            return ControllerResponse.conflict(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Calculation controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * GET /api/v1/calculations - List calculations, newest first
     */
    private ControllerResponse handleList(Map<String, List<String>> params) throws Exception {
        CalculationStatus status = param(params, "status").map(CalculationStatus::fromDb).orElse(null);
        CalculationKind kind = param(params, "kind").map(CalculationKind::fromCode).orElse(null);
        String material = param(params, "material").orElse(null);
        int limit = param(params, "limit").map(Integer::parseInt).orElse(DEFAULT_LIMIT);
        if (limit <= 0 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }

        List<CalculationResponse> body = calculationService.list(status, kind, material, limit).stream()
                .map(CalculationResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(body));
    }

    /**
     * GET /api/v1/calculations/{calcId}
     */
    private ControllerResponse handleGet(String calcId) throws Exception {
        Optional<Calculation> calc = calculationService.findById(calcId);
        if (calc.isEmpty()) {
            return ControllerResponse.notFound("calculation not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(CalculationResponse.from(calc.get())));
    }

    /**
     * POST /api/v1/calculations/{calcId}/cancel - optional body {"reason": "..."}
     */
    private ControllerResponse handleCancel(String calcId, FullHttpRequest req) throws Exception {
        String reason = null;
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (!body.isBlank()) {
            JsonNode node = RouterHandler.mapper().readTree(body);
            reason = node.hasNonNull("reason") ? node.get("reason").asText() : null;
        }

        TransitionResult result = calculationService.cancel(calcId, reason);
        return switch (result) {
            case APPLIED, UNCHANGED -> ControllerResponse.json(RouterHandler.mapper()
                    .writeValueAsString(OperationResponse.success(result.name().toLowerCase())));
            case NOT_FOUND -> ControllerResponse.json(HttpResponseStatus.NOT_FOUND,
                    RouterHandler.mapper().writeValueAsString(OperationResponse.calculationNotFound()));
            default -> ControllerResponse.json(HttpResponseStatus.CONFLICT,
                    RouterHandler.mapper().writeValueAsString(OperationResponse.error(result.name().toLowerCase())));
        };
    }

    private static Optional<String> param(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0).trim());
    }
}
