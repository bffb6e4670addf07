package com.acme.ztmc.access.transport.http;

import com.acme.ztmc.access.transport.api.InboundAccessRequest;
import com.acme.ztmc.access.transport.api.TransportAck;
import com.acme.ztmc.access.transport.api.TransportAdapter;
import com.acme.ztmc.access.transport.api.TransportNack;
import com.acme.ztmc.access.transport.api.TransportResponse;
import com.acme.ztmc.access.telemetry.NoopPipelineMetrics;
import com.acme.ztmc.access.telemetry.PipelineMetrics;
import com.acme.ztmc.access.util.AccessDefaults;
import com.acme.ztmc.access.util.AccessStatusCodes;
import com.acme.ztmc.access.util.JsonCodec;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP/1.1 front end: {@code POST /v1/access} with a JSON body.
 *
 * <p>Enforcement blocks on the audit log and on remediation calls, so requests are handed
 * off from the Netty event loop to a separate worker pool.</p>
 */
public final class NettyAccessHttpAdapter implements TransportAdapter {
    private static final Logger LOG = Logger.getLogger(NettyAccessHttpAdapter.class.getName());
    private static final String JSON = "application/json";

    private final int configuredPort;
    private final PipelineMetrics metrics;
    private final int handlerThreads;
    private final AtomicLong requestIds = new AtomicLong(1);

    private volatile InboundHandler inboundHandler = request ->
        new TransportNack(AccessStatusCodes.INTERNAL_ERROR, "no handler");

    private volatile EventLoopGroup bossGroup;
    private volatile EventLoopGroup workerGroup;
    private volatile ExecutorService handlerPool;
    private volatile Channel serverChannel;
    private volatile int boundPort;

    public NettyAccessHttpAdapter(int port) {
        this(port, Runtime.getRuntime().availableProcessors(), NoopPipelineMetrics.INSTANCE);
    }

    public NettyAccessHttpAdapter(int port, int handlerThreads, PipelineMetrics metrics) {
        this.configuredPort = port;
        this.boundPort = port;
        this.handlerThreads = Math.max(1, handlerThreads);
        this.metrics = metrics == null ? NoopPipelineMetrics.INSTANCE : metrics;
    }

    @Override
    public int listenPort() {
        return boundPort;
    }

    @Override
    public synchronized void start() throws Exception {
        if (serverChannel != null) {
            return;
        }

        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("access-http-boss", true));
        workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("access-http-io", true));
        handlerPool = Executors.newFixedThreadPool(handlerThreads, new DefaultThreadFactory("access-http-handler", true));

        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, AccessDefaults.DEFAULT_SO_BACKLOG)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new HttpServerCodec());
                        ch.pipeline().addLast(new HttpObjectAggregator(AccessDefaults.MAX_CONTENT_LENGTH));
                        ch.pipeline().addLast(new AccessHttpHandler());
                    }
                });

            serverChannel = bootstrap.bind(configuredPort).sync().channel();
            boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
            LOG.info(() -> "Access HTTP adapter started on port " + boundPort + " path=" + AccessDefaults.ACCESS_PATH);
        } catch (Exception e) {
            stop();
            throw e;
        }
    }

    @Override
    public synchronized void stop() throws Exception {
        Exception first = null;

        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            try {
                ch.close().syncUninterruptibly();
            } catch (Exception e) {
                first = e;
            }
        }

        ExecutorService pool = handlerPool;
        handlerPool = null;
        if (pool != null) {
            pool.shutdownNow();
        }

        EventLoopGroup workers = workerGroup;
        workerGroup = null;
        if (workers != null) {
            workers.shutdownGracefully().syncUninterruptibly();
        }

        EventLoopGroup boss = bossGroup;
        bossGroup = null;
        if (boss != null) {
            boss.shutdownGracefully().syncUninterruptibly();
        }

        if (ch != null) {
            LOG.info("Access HTTP adapter stopped");
        }

        if (first != null) {
            throw first;
        }
    }

    @Override
    public void setInboundHandler(InboundHandler handler) {
        this.inboundHandler = Objects.requireNonNull(handler, "handler");
    }

    private final class AccessHttpHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
            if (!req.decoderResult().isSuccess()) {
                metrics.incRejected(1L, AccessStatusCodes.BAD_REQUEST);
                writeError(ctx, req, HttpResponseStatus.BAD_REQUEST, "bad request");
                return;
            }
            if (!AccessDefaults.ACCESS_PATH.equals(stripQuery(req.uri()))) {
                metrics.incRejected(1L, AccessStatusCodes.NOT_FOUND);
                writeError(ctx, req, HttpResponseStatus.NOT_FOUND, "not found");
                return;
            }
            if (req.method() != HttpMethod.POST) {
                metrics.incRejected(1L, AccessStatusCodes.METHOD_NOT_ALLOWED);
                writeError(ctx, req, HttpResponseStatus.METHOD_NOT_ALLOWED, "method not allowed");
                return;
            }

            String body = req.content().toString(StandardCharsets.UTF_8);
            boolean keepAlive = HttpUtil.isKeepAlive(req);
            String remote = String.valueOf(ctx.channel().remoteAddress());
            InboundAccessRequest inbound = new InboundAccessRequest(requestIds.getAndIncrement(), body, remote);
            ExecutorService pool = handlerPool;
            if (pool == null) {
                writeError(ctx, keepAlive, HttpResponseStatus.INTERNAL_SERVER_ERROR, "shutting down");
                return;
            }
            try {
                pool.execute(() -> dispatch(ctx, keepAlive, inbound));
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Access request not dispatched requestId=" + inbound.requestId(), e);
                writeError(ctx, keepAlive, HttpResponseStatus.INTERNAL_SERVER_ERROR, "internal error");
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.SEVERE, "HTTP pipeline failure", cause);
            ctx.close();
        }
    }

    private void dispatch(ChannelHandlerContext ctx, boolean keepAlive, InboundAccessRequest inbound) {
        try {
            TransportResponse result = inboundHandler.onRequest(inbound);
            if (result instanceof TransportAck ack) {
                int code = ack.statusCode() > 0 ? ack.statusCode() : AccessStatusCodes.OK;
                writeResponse(ctx, keepAlive, HttpResponseStatus.valueOf(code), ack.jsonBody() == null ? "{}" : ack.jsonBody());
            } else if (result instanceof TransportNack nack) {
                int code = nack.statusCode() > 0 ? nack.statusCode() : AccessStatusCodes.INTERNAL_ERROR;
                writeError(ctx, keepAlive, HttpResponseStatus.valueOf(code), nack.error());
            } else {
                writeError(ctx, keepAlive, HttpResponseStatus.INTERNAL_SERVER_ERROR, "no response");
            }
        } catch (Throwable t) {
            LOG.log(Level.WARNING, "HTTP access handler failure requestId=" + inbound.requestId(), t);
            writeError(ctx, keepAlive, HttpResponseStatus.INTERNAL_SERVER_ERROR, "internal error");
        }
    }

    private static String stripQuery(String uri) {
        int q = uri.indexOf('?');
        return q >= 0 ? uri.substring(0, q) : uri;
    }

    private static void writeError(ChannelHandlerContext ctx, FullHttpRequest req, HttpResponseStatus status, String message) {
        writeError(ctx, HttpUtil.isKeepAlive(req), status, message);
    }

    private static void writeError(ChannelHandlerContext ctx, boolean keepAlive, HttpResponseStatus status, String message) {
        String json;
        try {
            json = JsonCodec.writeString(Map.of("error", message == null ? "" : message));
        } catch (Exception e) {
            json = "{\"error\":\"internal error\"}";
        }
        writeResponse(ctx, keepAlive, status, json);
    }

    private static void writeResponse(ChannelHandlerContext ctx, boolean keepAlive, HttpResponseStatus status, String json) {
        ByteBuf body = Unpooled.copiedBuffer(json, StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, body);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, JSON);
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, body.readableBytes());

        if (keepAlive) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }
}
