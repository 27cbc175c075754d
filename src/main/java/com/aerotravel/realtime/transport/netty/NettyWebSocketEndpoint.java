package com.aerotravel.realtime.transport.netty;

import com.aerotravel.realtime.transport.RealtimeTransportException;
import com.aerotravel.realtime.transport.WebSocketEndpoint;
import com.aerotravel.realtime.transport.WebSocketEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyWebSocketEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link WebSocketEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Parse Phoenix frames</li>
 *   <li>Track topics, joins or refs</li>
 *   <li>Schedule heartbeats, timeouts or reconnects</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup},
 * {@code WebSocketFrame}) MUST NOT escape this package. Inbound frames are
 * handed to the listener as {@code String}.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   [SslHandler] → HttpClientCodec → HttpObjectAggregator
 *       → WebSocketClientProtocolHandler → WebSocketFrameAggregator → InboundHandler
 * </pre>
 * Ping/pong and close frames are answered by the protocol handler.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} connects and performs the handshake; may be called again
 *   after the connection went down.
 * - {@link #disconnect(Throwable)} drops the current connection only.
 * - {@link #stop()} closes the channel and shuts down the event loop group.
 */
public final class NettyWebSocketEndpoint implements WebSocketEndpoint
{
    private static final int MAX_FRAME_BYTES = 1 << 20;

    private final URI uri;
    private final SslContext sslContext;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private volatile WebSocketEndpointListener listener;
    private volatile Channel channel;
    private volatile boolean stopped;

    // Channel of the current connection attempt; events from older channels are ignored.
    private volatile Channel attempt;

    // One down report per connection attempt.
    private final AtomicBoolean downReported = new AtomicBoolean(true);

    /**
     * @param uri {@code ws://} or {@code wss://} URI, query parameters included
     */
    public NettyWebSocketEndpoint(URI uri)
    {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.sslContext = "wss".equals(scheme(uri)) ? clientSslContext() : null;

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), uri.getHost(), port(uri)));
                        }
                        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                                uri, WebSocketVersion.V13, null, false, new DefaultHttpHeaders(), MAX_FRAME_BYTES);
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(8192));
                        p.addLast(new WebSocketClientProtocolHandler(handshaker));
                        p.addLast(new WebSocketFrameAggregator(MAX_FRAME_BYTES));
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(WebSocketEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        WebSocketEndpointListener l = requireListener();
        if (stopped) {
            throw new IllegalStateException("endpoint is stopped");
        }
        downReported.set(false);

        // Connect asynchronously; the handshake completion reports transport up.
        ChannelFuture f = bootstrap.connect(uri.getHost(), port(uri));
        attempt = f.channel();
        f.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                reportDown(l, future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        stopped = true;

        Channel ch = channel;
        channel = null;
        attempt = null;
        if (ch != null) {
            ch.close();
        }

        group.shutdownGracefully();

        WebSocketEndpointListener l = listener;
        if (l != null) {
            reportDown(l, null);
        }
    }

    @Override
    public void disconnect(Throwable cause)
    {
        Channel ch = channel;
        channel = null;
        attempt = null;

        WebSocketEndpointListener l = listener;
        if (ch != null && l != null) {
            reportDown(l, cause);
        }
        if (ch != null) {
            ch.close();
        }
    }

    @Override
    public boolean send(String text)
    {
        Objects.requireNonNull(text, "text");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return false;
        }
        ch.writeAndFlush(new TextWebSocketFrame(text));
        return true;
    }

    private void reportDown(WebSocketEndpointListener l, Throwable cause)
    {
        if (downReported.compareAndSet(false, true)) {
            l.onTransportDown(cause);
        }
    }

    private WebSocketEndpointListener requireListener()
    {
        WebSocketEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("WebSocketEndpointListener must be set before start()");
        }
        return l;
    }

    private static String scheme(URI uri)
    {
        return uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    }

    private static int port(URI uri)
    {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "wss".equals(scheme(uri)) ? 443 : 80;
    }

    private static SslContext clientSslContext()
    {
        try {
            return SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new RealtimeTransportException("Failed to create TLS context", e);
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Reports the completed handshake and forwards text frames to the port
     * listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<TextWebSocketFrame>
    {
        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                if (attempt != ctx.channel()) {
                    // Disconnected or stopped while the handshake was in flight.
                    ctx.close();
                    return;
                }
                channel = ctx.channel();
                WebSocketEndpointListener l = listener;
                if (l != null) {
                    l.onTransportUp();
                }
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame)
        {
            WebSocketEndpointListener l = listener;
            if (l == null) {
                return;
            }
            // Copy out of the reference-counted frame (Netty containment rule).
            l.onText(frame.text());
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            if (channel == ctx.channel()) {
                channel = null;
            }
            if (attempt != ctx.channel()) {
                // Already reported through disconnect() or stop().
                return;
            }
            WebSocketEndpointListener l = listener;
            if (l != null) {
                reportDown(l, null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            WebSocketEndpointListener l = listener;
            if (l != null && attempt == ctx.channel()) {
                reportDown(l, cause);
            }
            ctx.close();
        }
    }
}
