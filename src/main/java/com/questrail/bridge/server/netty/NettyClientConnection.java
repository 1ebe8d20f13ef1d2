package com.questrail.bridge.server.netty;

import com.questrail.bridge.clients.ClientConnection;
import com.questrail.bridge.clients.ClientSendException;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * {@link ClientConnection} over one Netty WebSocket channel.
 *
 * <p>Writes are queued on the channel's event loop, so {@link #send(String)}
 * never blocks the caller. A write that later fails closes the channel; the
 * registry then learns about it through {@code channelInactive}.</p>
 *
 * <p>A peer that stays connected but stops reading fills its outbound buffer
 * until the channel turns unwritable (see the server's write buffer water
 * mark). Such a peer is treated as failed: the channel is closed and
 * {@link #send(String)} throws, so the registry drops it instead of queueing
 * without bound.</p>
 */
final class NettyClientConnection implements ClientConnection
{
    private static final Logger log = LoggerFactory.getLogger(NettyClientConnection.class);

    private final Channel channel;
    private final String id;

    NettyClientConnection(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.id = channel.id().asShortText();
    }

    @Override
    public String id()
    {
        return id;
    }

    @Override
    public void send(String text)
    {
        Objects.requireNonNull(text, "text");
        if (!channel.isActive()) {
            throw new ClientSendException("Client " + id + " is not connected");
        }
        if (!channel.isWritable()) {
            log.warn("Client {} is not keeping up ({} bytes over the low water mark), closing",
                    id, channel.bytesBeforeWritable());
            channel.close();
            throw new ClientSendException("Client " + id + " is too slow: outbound buffer full");
        }
        channel.writeAndFlush(new TextWebSocketFrame(text)).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                log.warn("Failed to send to client {}: {}", id, String.valueOf(f.cause()));
                f.channel().close();
            }
        });
    }

    @Override
    public void close(int code, String reason)
    {
        if (channel.isActive()) {
            channel.writeAndFlush(new CloseWebSocketFrame(code, reason))
                    .addListener(ChannelFutureListener.CLOSE);
        }
        else {
            channel.close();
        }
    }

    @Override
    public String toString()
    {
        return "NettyClientConnection[" + id + "]";
    }
}
