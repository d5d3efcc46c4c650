package com.simpleamqp.transport;

import com.simpleamqp.amqp.AmqpCodec;
import com.simpleamqp.amqp.AmqpConstants;
import com.simpleamqp.amqp.AmqpFrame;
import com.simpleamqp.config.OpenOpts;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.security.GeneralSecurityException;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Netty-backed frame transport. The event loop decodes frames and parks them in a
 * blocking queue; the session's thread drains that queue through {@link #readFrame(long)}.
 */
public class NettyFrameTransport implements FrameTransport {
    private static final Logger logger = LoggerFactory.getLogger(NettyFrameTransport.class);

    // Marks the end of the inbound stream. Only ever compared by identity: its HEARTBEAT type
    // would make the session skip it as a heartbeat if it were ever handed out.
    private static final AmqpFrame END_OF_STREAM = new AmqpFrame(AmqpFrame.FrameType.HEARTBEAT, 0, Unpooled.EMPTY_BUFFER);

    private final EventLoopGroup group;
    private final BlockingQueue<AmqpFrame> inbound = new LinkedBlockingQueue<>();
    private final AmqpCodec.AmqpFrameDecoder frameDecoder = new AmqpCodec.AmqpFrameDecoder(AmqpConstants.DEFAULT_FRAME_MAX);
    private volatile Channel channel;
    private volatile Throwable failure;

    private NettyFrameTransport(EventLoopGroup group) {
        this.group = group;
    }

    /**
     * Open a TCP (or TLS) connection to the broker named in {@code opts}.
     */
    public static NettyFrameTransport connect(OpenOpts opts) throws IOException {
        SslContext sslContext = null;
        if (opts.getTls().isEnabled()) {
            try {
                sslContext = new TlsContextBuilder(opts.getTls()).buildClientContext();
            } catch (GeneralSecurityException e) {
                throw new IOException("Failed to set up TLS", e);
            }
        }

        EventLoopGroup group = new NioEventLoopGroup(1);
        NettyFrameTransport transport = new NettyFrameTransport(group);
        SslContext tls = sslContext;

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, opts.getConnectTimeoutMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        if (tls != null) {
                            SslHandler sslHandler = tls.newHandler(ch.alloc(), opts.getHost(), opts.getPort());
                            if (opts.getTls().isVerifyHostname()) {
                                SSLEngine engine = sslHandler.engine();
                                SSLParameters params = engine.getSSLParameters();
                                params.setEndpointIdentificationAlgorithm("HTTPS");
                                engine.setSSLParameters(params);
                            }
                            pipeline.addLast("ssl", sslHandler);
                        }
                        pipeline.addLast("frameDecoder", transport.frameDecoder);
                        pipeline.addLast("frameEncoder", new AmqpCodec.AmqpFrameEncoder());
                        pipeline.addLast("inbound", transport.new InboundFrameHandler());
                    }
                });

        ChannelFuture future = bootstrap.connect(opts.getHost(), opts.getPort()).awaitUninterruptibly();
        if (!future.isSuccess()) {
            group.shutdownGracefully();
            throw new IOException("Failed to connect to " + opts.getHost() + ":" + opts.getPort(), future.cause());
        }
        transport.channel = future.channel();
        logger.info("Connected to {}:{}{}", opts.getHost(), opts.getPort(), tls != null ? " (TLS)" : "");
        return transport;
    }

    @Override
    public void writeProtocolHeader() throws IOException {
        awaitWrite(channel.writeAndFlush(Unpooled.wrappedBuffer(AmqpConstants.PROTOCOL_HEADER)));
    }

    @Override
    public Optional<AmqpFrame> readFrame(long timeoutMillis) throws IOException {
        AmqpFrame frame;
        try {
            frame = timeoutMillis < 0 ? inbound.take() : inbound.poll(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for a frame");
        }
        if (frame == null) {
            return Optional.empty();
        }
        if (frame == END_OF_STREAM) {
            // Leave the marker for any later reader
            inbound.offer(END_OF_STREAM);
            throw new IOException("Connection to broker lost", failure);
        }
        return Optional.of(frame);
    }

    @Override
    public void writeFrame(AmqpFrame frame) throws IOException {
        if (channel == null || !channel.isActive()) {
            frame.release();
            throw new IOException("Cannot send frame, connection is not active", failure);
        }
        awaitWrite(channel.writeAndFlush(frame));
        logger.debug("Frame sent: {}", frame);
    }

    private void awaitWrite(ChannelFuture future) throws IOException {
        future.awaitUninterruptibly();
        if (!future.isSuccess()) {
            throw new IOException("Failed to write to broker", future.cause());
        }
    }

    @Override
    public void setMaxFrameSize(int frameMax) {
        frameDecoder.setMaxFrameSize(frameMax);
    }

    @Override
    public boolean isOpen() {
        return channel != null && channel.isActive();
    }

    @Override
    public void close() {
        try {
            if (channel != null) {
                channel.close().awaitUninterruptibly();
            }
        } finally {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            AmqpFrame frame;
            while ((frame = inbound.poll()) != null) {
                if (frame != END_OF_STREAM) {
                    frame.release();
                }
            }
        }
        logger.info("Transport closed");
    }

    private class InboundFrameHandler extends SimpleChannelInboundHandler<AmqpFrame> {

        InboundFrameHandler() {
            super(false); // frames are released by the session once consumed
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, AmqpFrame frame) {
            inbound.offer(frame);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            logger.debug("Connection to broker became inactive");
            inbound.offer(END_OF_STREAM);
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            logger.error("Transport error, closing connection", cause);
            failure = cause;
            ctx.close();
        }
    }
}
