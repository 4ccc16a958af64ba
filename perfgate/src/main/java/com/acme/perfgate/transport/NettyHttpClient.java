package com.acme.perfgate.transport;

import com.acme.perfgate.util.GateDefaults;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http2.DefaultHttp2Headers;
import io.netty.handler.codec.http2.DefaultHttp2HeadersFrame;
import io.netty.handler.codec.http2.Http2DataFrame;
import io.netty.handler.codec.http2.Http2FrameCodecBuilder;
import io.netty.handler.codec.http2.Http2Headers;
import io.netty.handler.codec.http2.Http2HeadersFrame;
import io.netty.handler.codec.http2.Http2MultiplexHandler;
import io.netty.handler.codec.http2.Http2StreamChannel;
import io.netty.handler.codec.http2.Http2StreamChannelBootstrap;
import io.netty.util.ReferenceCountUtil;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Minimal blocking HTTP client for readiness canaries, warm-up traffic and simulator stats.
 * One connection per request; HTTP/1.1 or cleartext HTTP/2 with prior knowledge.
 */
public final class NettyHttpClient implements AutoCloseable {
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    public NettyHttpClient() {
        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap()
            .group(group)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.TCP_NODELAY, true);
    }

    /**
     * HTTP/1.1 request with {@code Connection: close}.
     *
     * @throws SocketTimeoutException when connect plus response exceeds {@code totalTimeoutMs}
     * @throws IOException           on connection failure or premature close
     */
    public HttpReply send(HttpMethod method,
                          URI uri,
                          Map<String, String> headers,
                          byte[] body,
                          int connectTimeoutMs,
                          int totalTimeoutMs) throws IOException, InterruptedException {
        CompletableFuture<HttpReply> reply = new CompletableFuture<>();
        AtomicReference<Channel> channelRef = new AtomicReference<>();
        Bootstrap b = bootstrap.clone()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.max(1, connectTimeoutMs))
            .handler(new ChannelInitializer<Channel>() {
                @Override
                protected void initChannel(Channel ch) {
                    ch.pipeline().addLast(new HttpClientCodec());
                    ch.pipeline().addLast(new HttpObjectAggregator(GateDefaults.HTTP_RESPONSE_LIMIT));
                    ch.pipeline().addLast(new Http1ResponseHandler(reply));
                }
            });

        b.connect(uri.getHost(), port(uri)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                reply.completeExceptionally(future.cause());
                return;
            }
            channelRef.set(future.channel());
            ByteBuf content = body == null ? Unpooled.EMPTY_BUFFER : Unpooled.wrappedBuffer(body);
            FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, pathAndQuery(uri), content);
            request.headers().set(HttpHeaderNames.HOST, authority(uri));
            request.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            request.headers().set(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());
            if (headers != null) {
                headers.forEach((k, v) -> request.headers().set(k, v));
            }
            future.channel().writeAndFlush(request);
        });
        return await(reply, channelRef, totalTimeoutMs, uri);
    }

    /**
     * GET over cleartext HTTP/2 without an upgrade round-trip, for servers that only speak h2c.
     */
    public HttpReply getH2cPriorKnowledge(URI uri, int totalTimeoutMs) throws IOException, InterruptedException {
        CompletableFuture<HttpReply> reply = new CompletableFuture<>();
        AtomicReference<Channel> channelRef = new AtomicReference<>();
        Bootstrap b = bootstrap.clone()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.max(1, totalTimeoutMs))
            .handler(new ChannelInitializer<Channel>() {
                @Override
                protected void initChannel(Channel ch) {
                    ch.pipeline().addLast(Http2FrameCodecBuilder.forClient().build());
                    ch.pipeline().addLast(new Http2MultiplexHandler(new ChannelInboundHandlerAdapter()));
                }
            });

        b.connect(uri.getHost(), port(uri)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                reply.completeExceptionally(future.cause());
                return;
            }
            Channel parent = future.channel();
            channelRef.set(parent);
            new Http2StreamChannelBootstrap(parent)
                .handler(new Http2ResponseHandler(reply))
                .open()
                .addListener(opened -> {
                    if (!opened.isSuccess()) {
                        reply.completeExceptionally(opened.cause());
                        return;
                    }
                    Http2StreamChannel stream = (Http2StreamChannel) opened.getNow();
                    Http2Headers h2Headers = new DefaultHttp2Headers()
                        .method("GET")
                        .scheme("http")
                        .authority(authority(uri))
                        .path(pathAndQuery(uri));
                    stream.writeAndFlush(new DefaultHttp2HeadersFrame(h2Headers, true));
                });
        });
        return await(reply, channelRef, totalTimeoutMs, uri);
    }

    private static HttpReply await(CompletableFuture<HttpReply> reply,
                                   AtomicReference<Channel> channelRef,
                                   int totalTimeoutMs,
                                   URI uri) throws IOException, InterruptedException {
        try {
            return reply.get(Math.max(1, totalTimeoutMs), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new SocketTimeoutException("no response from " + uri + " within " + totalTimeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("request to " + uri + " failed: " + cause, cause);
        } finally {
            Channel channel = channelRef.get();
            if (channel != null) {
                channel.close();
            }
        }
    }

    private static int port(URI uri) {
        if (uri.getPort() > 0) {
            return uri.getPort();
        }
        return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    private static String authority(URI uri) {
        return uri.getHost() + ":" + port(uri);
    }

    private static String pathAndQuery(URI uri) {
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        return uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery();
    }

    @Override
    public void close() {
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private static final class Http1ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
        private final CompletableFuture<HttpReply> reply;

        private Http1ResponseHandler(CompletableFuture<HttpReply> reply) {
            this.reply = reply;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response) {
            reply.complete(new HttpReply(response.status().code(), response.content().toString(StandardCharsets.UTF_8)));
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            reply.completeExceptionally(new IOException("connection closed before response"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            reply.completeExceptionally(cause);
            ctx.close();
        }
    }

    private static final class Http2ResponseHandler extends ChannelInboundHandlerAdapter {
        private final CompletableFuture<HttpReply> reply;
        private final ByteArrayOutputStream body = new ByteArrayOutputStream();
        private int status = -1;

        private Http2ResponseHandler(CompletableFuture<HttpReply> reply) {
            this.reply = reply;
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            try {
                boolean endStream = false;
                if (msg instanceof Http2HeadersFrame headersFrame) {
                    CharSequence statusValue = headersFrame.headers().status();
                    if (statusValue != null && status < 0) {
                        status = Integer.parseInt(statusValue.toString());
                    }
                    endStream = headersFrame.isEndStream();
                } else if (msg instanceof Http2DataFrame dataFrame) {
                    ByteBuf content = dataFrame.content();
                    byte[] chunk = new byte[content.readableBytes()];
                    content.readBytes(chunk);
                    body.write(chunk, 0, chunk.length);
                    endStream = dataFrame.isEndStream();
                }
                if (endStream) {
                    reply.complete(new HttpReply(status, body.toString(StandardCharsets.UTF_8)));
                    ctx.close();
                }
            } finally {
                ReferenceCountUtil.release(msg);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            reply.completeExceptionally(new IOException("h2 stream closed before response"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            reply.completeExceptionally(cause);
            ctx.close();
        }
    }
}
