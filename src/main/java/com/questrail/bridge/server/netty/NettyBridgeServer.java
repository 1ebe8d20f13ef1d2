package com.questrail.bridge.server.netty;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.bridge.router.BridgeRouter;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * NettyBridgeServer
 * =============================================================================
 * HTTP and WebSocket front end of the bridge on one TCP port.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   HttpServerCodec
 *     → HttpObjectAggregator
 *       → WebSocketServerProtocolHandler("/ws")   handshake, ping/pong, close
 *         → HttpApiHandler                        plain HTTP requests
 *         → WebSocketClientHandler                frames of admitted peers
 * </pre>
 * The two application handlers run on a separate executor group because they
 * call into the serial link, which blocks. Each channel stays pinned to one
 * executor thread, so a peer's frames are handled in arrival order.
 *
 * <h2>Netty containment rule</h2>
 * Netty types do not escape this package; the rest of the bridge sees only
 * {@link com.questrail.bridge.clients.ClientConnection}.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds synchronously and fails fast if the port is taken.
 * - {@link #stop()} closes the listening channel and shuts down all groups.
 */
public final class NettyBridgeServer
{
    private static final Logger log = LoggerFactory.getLogger(NettyBridgeServer.class);

    public static final String WEBSOCKET_PATH = "/ws";
    static final int MAX_CONTENT_LENGTH = 64 * 1024;

    /**
     * Per-client outbound queue limits. A client whose queue passes the high
     * mark is disconnected on the next send.
     */
    static final WriteBufferWaterMark CLIENT_WRITE_WATER_MARK =
            new WriteBufferWaterMark(256 * 1024, 1024 * 1024);

    private final InetSocketAddress bindAddress;
    private final BridgeRouter router;
    private final HttpApiHandler httpHandler;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final EventExecutorGroup handlerGroup;

    private volatile Channel serverChannel;

    public NettyBridgeServer(InetSocketAddress bindAddress, BridgeRouter router, ObjectMapper mapper)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.router = Objects.requireNonNull(router, "router");
        this.httpHandler = new HttpApiHandler(router, mapper);

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.handlerGroup = new DefaultEventExecutorGroup(4);
    }

    /**
     * Bind the listening socket.
     *
     * @throws InterruptedException if interrupted while binding
     */
    public void start() throws InterruptedException
    {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.WRITE_BUFFER_WATER_MARK, CLIENT_WRITE_WATER_MARK)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                        p.addLast(new WebSocketServerProtocolHandler(WEBSOCKET_PATH));
                        p.addLast(handlerGroup, "http-api", httpHandler);
                        p.addLast(handlerGroup, "ws-client", new WebSocketClientHandler(router));
                    }
                });

        serverChannel = bootstrap.bind(bindAddress).sync().channel();
        log.info("Bridge server listening on {}", serverChannel.localAddress());
    }

    public void stop()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }

        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully().syncUninterruptibly();
        handlerGroup.shutdownGracefully();
        log.info("Bridge server stopped");
    }

    /**
     * Block until the listening channel closes.
     */
    public void awaitClose() throws InterruptedException
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.closeFuture().sync();
        }
    }

    /**
     * The bound address, or {@code null} before {@link #start()}. Useful when
     * binding to port 0.
     */
    public InetSocketAddress localAddress()
    {
        Channel ch = serverChannel;
        return ch == null ? null : (InetSocketAddress) ch.localAddress();
    }
}
