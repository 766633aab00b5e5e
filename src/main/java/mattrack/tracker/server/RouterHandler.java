package mattrack.tracker.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import mattrack.tracker.api.Controller;
import mattrack.tracker.api.Controller.ControllerResponse;
import mattrack.tracker.config.TrackerConfig;
import mattrack.tracker.model.IllegalTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_LENGTH;
import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches requests to the first registered controller that matches.
 *
 * /api/v1/* is open. /internal/v1/* (job-script callbacks) requires {@value #KEY_HEADER}
 * when an API key is configured. Anything else is 404.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    public static final String KEY_HEADER = "X-Mattrack-Key";

    private final List<Controller> controllers = new ArrayList<>();
    private final TrackerConfig config;

    public RouterHandler(TrackerConfig config) {
        this.config = config;
    }

    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        HttpMethod method = req.method();
        String path = new QueryStringDecoder(req.uri()).path();
        write(ctx, dispatch(ctx, req, method, path));
    }

    private ControllerResponse dispatch(ChannelHandlerContext ctx, FullHttpRequest req, HttpMethod method,
            String path) {
        if (!authorized(req, path)) {
            log.warn("Rejected {} {}: missing or wrong {}", method, path, KEY_HEADER);
            return ControllerResponse.errorJson(FORBIDDEN, "forbidden");
        }
        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    return controller.handle(ctx, req, path);
                }
            }
            log.debug("No handler for: {} {}", method, path);
            return ControllerResponse.notFound("not found");
        } catch (IllegalTransitionException e) {
            log.warn("Rejected transition: {}", e.getMessage());
            return ControllerResponse.conflict(e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Bad request {} {}: {}", method, path, e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Handler error: {} {}", method, path, e);
            return ControllerResponse.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private boolean authorized(FullHttpRequest req, String path) {
        if (!config.hasApiKey() || !path.startsWith("/internal/")) {
            return true;
        }
        return config.apiKey().equals(req.headers().get(KEY_HEADER));
    }

    private static void write(ChannelHandlerContext ctx, ControllerResponse response) {
        byte[] bytes = response.body() != null ? response.body().getBytes(StandardCharsets.UTF_8) : new byte[0];
        FullHttpResponse http = new DefaultFullHttpResponse(HTTP_1_1, response.status(), Unpooled.wrappedBuffer(bytes));
        http.headers().set(CONTENT_TYPE, response.contentType() + "; charset=utf-8");
        http.headers().setInt(CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(http).addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Channel error, closing connection: {}", cause.getMessage(), cause);
        ctx.close();
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
