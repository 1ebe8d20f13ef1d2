package com.questrail.bridge.server.netty;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.bridge.router.BridgeRouter;
import com.questrail.bridge.router.BridgeStatus;
import com.questrail.bridge.router.PublishOutcome;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * HttpApiHandler
 * =============================================================================
 * The REST surface of the bridge.
 *
 * <pre>
 *   GET  /             server banner
 *   GET  /api/status   link, client and server status
 *   POST /api/publish  write {topic, payload} to the device
 * </pre>
 *
 * Every response is JSON and carries {@code Access-Control-Allow-Origin: *}.
 * Errors use a {@code {"detail": ...}} body. WebSocket upgrades for
 * {@code /ws} never reach this handler.
 *
 * <p>Stateless; one instance is shared by all channels. It runs on the
 * blocking executor group because a publish performs a serial write.</p>
 */
@ChannelHandler.Sharable
final class HttpApiHandler extends SimpleChannelInboundHandler<FullHttpRequest>
{
    private static final Logger log = LoggerFactory.getLogger(HttpApiHandler.class);

    static final String SERVER_NAME = "Arduino Bridge Server";
    static final String VERSION = "1.0.0";

    private final BridgeRouter router;
    private final ObjectMapper mapper;

    HttpApiHandler(BridgeRouter router, ObjectMapper mapper)
    {
        this.router = Objects.requireNonNull(router, "router");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request)
    {
        String path = new QueryStringDecoder(request.uri()).path();
        HttpMethod method = request.method();

        if (HttpMethod.OPTIONS.equals(method)) {
            writePreflight(ctx, request);
            return;
        }

        switch (path) {
            case "/" -> {
                if (requireMethod(ctx, request, HttpMethod.GET)) {
                    writeJson(ctx, request, HttpResponseStatus.OK, banner());
                }
            }
            case "/api/status" -> {
                if (requireMethod(ctx, request, HttpMethod.GET)) {
                    writeJson(ctx, request, HttpResponseStatus.OK, statusBody(router.status()));
                }
            }
            case "/api/publish" -> {
                if (requireMethod(ctx, request, HttpMethod.POST)) {
                    handlePublish(ctx, request);
                }
            }
            default -> writeError(ctx, request, HttpResponseStatus.NOT_FOUND, "Not Found");
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        log.error("HTTP handler failure on {}", ctx.channel(), cause);
        ctx.close();
    }

    // -------------------------------------------------------------------------
    // Routes
    // -------------------------------------------------------------------------

    private static Map<String, Object> banner()
    {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", SERVER_NAME);
        body.put("version", VERSION);
        body.put("status", "running");
        return body;
    }

    static Map<String, Object> statusBody(BridgeStatus status)
    {
        Map<String, Object> serial = new LinkedHashMap<>();
        serial.put("connected", status.connected());
        serial.put("state", status.linkState().name().toLowerCase(Locale.ROOT));
        serial.put("port", status.portName());
        serial.put("baudrate", status.baudRate());

        Map<String, Object> websocket = new LinkedHashMap<>();
        websocket.put("active_connections", status.activeConnections());
        websocket.put("max_connections", status.maxConnections());

        Map<String, Object> server = new LinkedHashMap<>();
        server.put("status", "running");
        server.put("version", VERSION);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("serial", serial);
        body.put("websocket", websocket);
        body.put("server", server);
        return body;
    }

    private void handlePublish(ChannelHandlerContext ctx, FullHttpRequest request)
    {
        if (!router.status().connected()) {
            writeError(ctx, request, HttpResponseStatus.SERVICE_UNAVAILABLE, "Serial port not connected");
            return;
        }

        final String topic;
        final String payload;
        try {
            JsonNode body = mapper.readTree(request.content().toString(StandardCharsets.UTF_8));
            if (body == null || !body.isObject()) {
                writeError(ctx, request, HttpResponseStatus.BAD_REQUEST, "Request body must be a JSON object");
                return;
            }
            topic = body.path("topic").asText("");
            payload = body.path("payload").asText("");
        } catch (JsonProcessingException e) {
            writeError(ctx, request, HttpResponseStatus.BAD_REQUEST, "Invalid JSON format");
            return;
        }

        PublishOutcome outcome = router.publish(topic, payload);
        switch (outcome) {
            case PUBLISHED -> {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("success", true);
                body.put("topic", topic);
                body.put("payload", payload);
                body.put("message", "Message published successfully");
                writeJson(ctx, request, HttpResponseStatus.OK, body);
            }
            case LINK_UNAVAILABLE ->
                    writeError(ctx, request, HttpResponseStatus.SERVICE_UNAVAILABLE, "Serial port not connected");
            case INVALID_TOPIC ->
                    writeError(ctx, request, HttpResponseStatus.BAD_REQUEST, "Topic cannot be empty");
            case WRITE_FAILED ->
                    writeError(ctx, request, HttpResponseStatus.INTERNAL_SERVER_ERROR, "Failed to write to serial port");
        }
    }

    // -------------------------------------------------------------------------
    // Response plumbing
    // -------------------------------------------------------------------------

    private boolean requireMethod(ChannelHandlerContext ctx, FullHttpRequest request, HttpMethod expected)
    {
        if (expected.equals(request.method())) {
            return true;
        }
        writeError(ctx, request, HttpResponseStatus.METHOD_NOT_ALLOWED, "Method Not Allowed");
        return false;
    }

    private void writeError(ChannelHandlerContext ctx,
                            FullHttpRequest request,
                            HttpResponseStatus status,
                            String detail)
    {
        writeJson(ctx, request, status, Map.of("detail", detail));
    }

    private void writeJson(ChannelHandlerContext ctx,
                           FullHttpRequest request,
                           HttpResponseStatus status,
                           Object body)
    {
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize HTTP response", e);
            status = HttpResponseStatus.INTERNAL_SERVER_ERROR;
            bytes = "{\"detail\":\"Internal server error\"}".getBytes(StandardCharsets.UTF_8);
        }

        ByteBuf content = Unpooled.wrappedBuffer(bytes);
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, content);
        response.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                .setInt(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes())
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        send(ctx, request, response);
    }

    private void writePreflight(ChannelHandlerContext ctx, FullHttpRequest request)
    {
        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, HttpResponseStatus.NO_CONTENT, Unpooled.EMPTY_BUFFER);
        response.headers()
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*")
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS, "GET, POST, OPTIONS")
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS, "*")
                .setInt(HttpHeaderNames.CONTENT_LENGTH, 0);
        send(ctx, request, response);
    }

    private static void send(ChannelHandlerContext ctx, FullHttpRequest request, FullHttpResponse response)
    {
        boolean keepAlive = HttpUtil.isKeepAlive(request);
        HttpUtil.setKeepAlive(response, keepAlive);
        ChannelFuture f = ctx.writeAndFlush(response);
        if (!keepAlive) {
            f.addListener(ChannelFutureListener.CLOSE);
        }
    }
}
