package com.questrail.interactions.transport.http.netty;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.interactions.api.Interaction;
import com.questrail.interactions.api.InteractionKind;
import com.questrail.interactions.api.InteractionResponse;
import com.questrail.interactions.transport.InteractionRequestHandler;
import com.questrail.interactions.transport.InteractionServer;
import com.questrail.interactions.transport.http.InteractionCodecException;
import com.questrail.interactions.transport.http.InteractionJsonCodec;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NettyHttpInteractionServer
 * =============================================================================
 * Netty-backed implementation of the {@link InteractionServer} port: the
 * platform POSTs interactions and the reply body is the initial response.
 *
 * <h2>Architectural role</h2>
 * This class is a transport adapter. It decodes and encodes JSON and maps
 * failures to HTTP status codes; routing and response state live in the
 * installed {@link InteractionRequestHandler}s.
 *
 * <h2>Netty containment rule</h2>
 * Netty types do not escape this package.
 *
 * <h2>Threading</h2>
 * Handlers block until the initial response exists, so requests are handed
 * from the event loop to a dedicated dispatch pool.
 *
 * <h2>Status codes</h2>
 * <ul>
 *   <li>{@code 200}: the handler's response, or the pong for a ping</li>
 *   <li>{@code 400}: body is not a valid interaction payload</li>
 *   <li>{@code 404}: wrong path, or no handler for the interaction kind</li>
 *   <li>{@code 405}: not a POST</li>
 *   <li>{@code 500}: the handler failed</li>
 * </ul>
 */
public final class NettyHttpInteractionServer implements InteractionServer
{
    private static final Logger log = LoggerFactory.getLogger(NettyHttpInteractionServer.class);

    private static final int MAX_CONTENT_LENGTH = 1 << 20;

    private final InetSocketAddress bindAddress;
    private final String path;
    private final InteractionJsonCodec codec;

    private final Map<InteractionKind, InteractionRequestHandler> handlers = new ConcurrentHashMap<>();

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ExecutorService dispatchExecutor;
    private final ServerBootstrap bootstrap;

    private volatile Channel channel;

    public NettyHttpInteractionServer(InetSocketAddress bindAddress) {
        this(bindAddress, "/", new InteractionJsonCodec());
    }

    public NettyHttpInteractionServer(InetSocketAddress bindAddress, String path, InteractionJsonCodec codec)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.path = Objects.requireNonNull(path, "path");
        this.codec = Objects.requireNonNull(codec, "codec");

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.dispatchExecutor = Executors.newCachedThreadPool(dispatchThreads());
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                        p.addLast(new InboundHandler());
                    }
                });
    }

    /**
     * Bind the listening socket. Blocks until the bind completed.
     *
     * @throws IllegalStateException if the bind failed
     */
    public void start()
    {
        ChannelFuture f = bootstrap.bind(bindAddress).syncUninterruptibly();
        if (!f.isSuccess()) {
            throw new IllegalStateException("Failed to bind interaction server to " + bindAddress, f.cause());
        }
        channel = f.channel();
        log.info("Interaction server listening on {}{}", channel.localAddress(), path);
    }

    public void stop()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close().syncUninterruptibly();
            channel = null;
        }
        workerGroup.shutdownGracefully();
        bossGroup.shutdownGracefully();
        dispatchExecutor.shutdown();
        log.info("Interaction server stopped");
    }

    /**
     * @throws IllegalStateException if the server has not been started
     */
    public InetSocketAddress localAddress()
    {
        Channel ch = channel;
        if (ch == null) {
            throw new IllegalStateException("Interaction server is not started");
        }
        return (InetSocketAddress) ch.localAddress();
    }

    @Override
    public void setRequestHandler(InteractionKind kind, InteractionRequestHandler handler)
    {
        handlers.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(handler, "handler"));
    }

    @Override
    public void clearRequestHandler(InteractionKind kind, InteractionRequestHandler expected)
    {
        handlers.remove(kind, expected);
    }

    private FullHttpResponse handle(byte[] body)
    {
        JsonNode payload;
        try {
            payload = codec.parse(body);
            if (codec.isPing(payload)) {
                return json(HttpResponseStatus.OK, codec.pong());
            }
        } catch (InteractionCodecException e) {
            log.debug("Rejecting undecodable interaction payload: {}", e.getMessage());
            return text(HttpResponseStatus.BAD_REQUEST, e.getMessage());
        }

        Interaction interaction;
        try {
            interaction = codec.toInteraction(payload);
        } catch (InteractionCodecException e) {
            log.debug("Rejecting interaction payload: {}", e.getMessage());
            return text(HttpResponseStatus.BAD_REQUEST, e.getMessage());
        }

        InteractionRequestHandler handler = handlers.get(interaction.kind());
        if (handler == null) {
            log.warn("No handler installed for {} interaction {}", interaction.kind(), interaction.id());
            return text(HttpResponseStatus.NOT_FOUND, "No handler for " + interaction.kind());
        }

        try {
            InteractionResponse response = handler.handle(interaction);
            return json(HttpResponseStatus.OK, codec.encode(response));
        } catch (RuntimeException e) {
            log.error("Handler failed for {} interaction {}", interaction.kind(), interaction.id(), e);
            return text(HttpResponseStatus.INTERNAL_SERVER_ERROR, "Interaction handler failed");
        }
    }

    private static FullHttpResponse json(HttpResponseStatus status, byte[] body) {
        return response(status, body, "application/json");
    }

    private static FullHttpResponse text(HttpResponseStatus status, String body) {
        return response(status, body.getBytes(StandardCharsets.UTF_8), "text/plain; charset=UTF-8");
    }

    private static FullHttpResponse response(HttpResponseStatus status, byte[] body, String contentType)
    {
        FullHttpResponse response = new DefaultFullHttpResponse(
            HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(body));
        response.headers()
            .set(HttpHeaderNames.CONTENT_TYPE, contentType)
            .setInt(HttpHeaderNames.CONTENT_LENGTH, body.length)
            .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        return response;
    }

    private static ThreadFactory dispatchThreads()
    {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "interaction-http-dispatch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Validates method and path on the event loop, copies the body out of the
     * reference-counted buffer and hands it to the dispatch pool.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<FullHttpRequest>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request)
        {
            String requestPath = new QueryStringDecoder(request.uri()).path();
            if (!path.equals(requestPath)) {
                reply(ctx, text(HttpResponseStatus.NOT_FOUND, "Unknown path " + requestPath));
                return;
            }
            if (!HttpMethod.POST.equals(request.method())) {
                reply(ctx, text(HttpResponseStatus.METHOD_NOT_ALLOWED, "Interactions must be POSTed"));
                return;
            }

            ByteBuf content = request.content();
            byte[] body = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), body);

            try {
                dispatchExecutor.execute(() -> reply(ctx, handle(body)));
            } catch (RejectedExecutionException e) {
                reply(ctx, text(HttpResponseStatus.SERVICE_UNAVAILABLE, "Interaction server is stopping"));
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Closing interaction connection after error", cause);
            ctx.close();
        }

        private void reply(ChannelHandlerContext ctx, FullHttpResponse response)
        {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }
}
