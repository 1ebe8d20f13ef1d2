package com.questrail.bridge.server.netty;

import com.questrail.bridge.router.BridgeRouter;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * WebSocketClientHandler
 * -----------------------------------------------------------------------------
 * Per-channel bridge between one WebSocket peer and the {@link BridgeRouter}.
 *
 * <p>Admission happens when the handshake completes. A rejected peer is closed
 * with {@link #POLICY_VIOLATION} and nothing more is forwarded for it. Text
 * frames of an admitted peer go to the router in arrival order; other data
 * frames are ignored. Control frames are answered by Netty's protocol
 * handler.</p>
 */
final class WebSocketClientHandler extends SimpleChannelInboundHandler<WebSocketFrame>
{
    private static final Logger log = LoggerFactory.getLogger(WebSocketClientHandler.class);

    static final int POLICY_VIOLATION = 1008;
    static final String CAPACITY_REASON = "Connection limit reached";

    private final BridgeRouter router;

    private NettyClientConnection connection;
    private boolean admitted;

    WebSocketClientHandler(BridgeRouter router)
    {
        this.router = Objects.requireNonNull(router, "router");
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
    {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            connection = new NettyClientConnection(ctx.channel());
            log.info("New WebSocket connection attempt from client {}", connection.id());
            admitted = router.onClientConnected(connection);
            if (!admitted) {
                log.warn("Connection rejected for client {}: limit reached", connection.id());
                connection.close(POLICY_VIOLATION, CAPACITY_REASON);
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame)
    {
        if (!admitted) {
            return;
        }
        if (frame instanceof TextWebSocketFrame text) {
            router.handleClientText(connection, text.text());
        }
        else {
            log.debug("Ignoring {} from client {}", frame.getClass().getSimpleName(), connection.id());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        if (admitted) {
            admitted = false;
            log.info("Client {} disconnected", connection.id());
            router.onClientDisconnected(connection);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        String id = connection != null ? connection.id() : ctx.channel().id().asShortText();
        log.error("WebSocket error for client {}: {}", id, String.valueOf(cause));
        ctx.close();
    }
}
