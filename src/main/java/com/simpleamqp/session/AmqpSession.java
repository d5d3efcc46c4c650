package com.simpleamqp.session;

import com.simpleamqp.amqp.AmqpConstants;
import com.simpleamqp.amqp.AmqpFrame;
import com.simpleamqp.amqp.AmqpMethod;
import com.simpleamqp.amqp.ContentHeader;
import com.simpleamqp.amqp.MethodArgs;
import com.simpleamqp.config.OpenOpts;
import com.simpleamqp.confirms.PublisherConfirms;
import com.simpleamqp.consumer.ConsumerRegistry;
import com.simpleamqp.exception.AmqpProtocolException;
import com.simpleamqp.exception.AmqpTransportException;
import com.simpleamqp.exception.ConnectionClosedException;
import com.simpleamqp.exception.ConsumerCancelledException;
import com.simpleamqp.model.Envelope;
import com.simpleamqp.model.Message;
import com.simpleamqp.transport.FrameTransport;
import com.simpleamqp.transport.NettyFrameTransport;
import io.netty.buffer.Unpooled;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One AMQP 0-9-1 connection and the channels multiplexed over it.
 *
 * <p>Every channel is opened in publisher-confirm mode, so {@link #basicPublish} returns
 * only once the broker has accepted the message. A session is driven by one thread at a
 * time; it does no locking of its own.
 */
public class AmqpSession implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AmqpSession.class);

    private static final Pattern VERSION_PATTERN = Pattern.compile("(\\d+)\\.(\\d+)\\.(\\d+)");
    private static final Set<AmqpMethod> CONSUME_REPLIES =
            EnumSet.of(AmqpMethod.BASIC_DELIVER, AmqpMethod.BASIC_CANCEL);

    private final FrameTransport transport;
    private final ChannelPool pool;
    private final FrameDemultiplexer demux;
    private final RpcEngine rpc;
    private final MessageAssembler assembler;
    private final PublisherConfirms confirms;
    private final ConsumerRegistry consumers = new ConsumerRegistry();
    private Map<String, Object> serverProperties = Collections.emptyMap();
    private int frameMax = AmqpConstants.DEFAULT_FRAME_MAX;

    public AmqpSession(FrameTransport transport) {
        this.transport = transport;
        this.pool = new ChannelPool(transport, this::openChannel);
        this.demux = new FrameDemultiplexer(transport, pool);
        this.rpc = new RpcEngine(transport, demux);
        this.assembler = new MessageAssembler(demux);
        this.demux.setBufferListener(assembler);
        this.confirms = new PublisherConfirms(demux, assembler, pool);
    }

    /**
     * Connect to the broker described by {@code opts} and log in.
     *
     * @throws AmqpTransportException if the broker cannot be reached
     * @throws ConnectionClosedException if the broker refuses the login
     */
    public static AmqpSession open(OpenOpts opts) {
        checkFrameMax(opts.getFrameMax());
        NettyFrameTransport transport;
        try {
            transport = NettyFrameTransport.connect(opts);
        } catch (IOException e) {
            throw new AmqpTransportException("Failed to connect to " + opts.getHost() + ":" + opts.getPort(), e);
        }
        AmqpSession session = new AmqpSession(transport);
        try {
            session.login(opts);
        } catch (RuntimeException e) {
            transport.close();
            throw e;
        }
        return session;
    }

    public static AmqpSession open(String uri) {
        return open(OpenOpts.fromUri(uri));
    }

    void login(OpenOpts opts) {
        checkFrameMax(opts.getFrameMax());
        OpenOpts.Auth auth = opts.getAuth();
        try {
            transport.writeProtocolHeader();
        } catch (IOException e) {
            throw new AmqpTransportException("Failed to send protocol header", e);
        }

        AmqpFrame startFrame = demux.getMethodOnChannel(0, EnumSet.of(AmqpMethod.CONNECTION_START), FrameTransport.INFINITE)
                .orElseThrow(() -> new IllegalStateException("No reply without a timeout"));
        MethodArgs.Start start = MethodArgs.decodeStart(startFrame);
        serverProperties = start.getServerProperties();
        if (!start.supportsMechanism(auth.getMechanism())) {
            throw new AmqpProtocolException("Broker does not offer SASL mechanism " + auth.getMechanism()
                    + " (offered: " + start.getMechanisms() + ")");
        }

        AmqpFrame tuneFrame = rpc.doRpcOnChannel(0, AmqpMethod.CONNECTION_START_OK,
                MethodArgs.connectionStartOk(clientProperties(), auth.getMechanism(), auth.getResponse(),
                        AmqpConstants.DEFAULT_LOCALE),
                EnumSet.of(AmqpMethod.CONNECTION_TUNE));
        MethodArgs.Tune tune = MethodArgs.decodeTune(tuneFrame);

        int channelMax = negotiate(0, tune.getChannelMax());
        int negotiatedFrameMax = negotiate(opts.getFrameMax(), tune.getFrameMax());
        checkFrameMax(negotiatedFrameMax);
        rpc.sendMethod(0, AmqpMethod.CONNECTION_TUNE_OK,
                MethodArgs.connectionTuneOk(channelMax, negotiatedFrameMax, AmqpConstants.HEARTBEAT_DISABLED));
        pool.setChannelMax(channelMax);
        frameMax = negotiatedFrameMax == 0 ? Integer.MAX_VALUE : negotiatedFrameMax;
        transport.setMaxFrameSize(frameMax);

        rpc.doRpcOnChannel(0, AmqpMethod.CONNECTION_OPEN, MethodArgs.connectionOpen(opts.getVhost()),
                EnumSet.of(AmqpMethod.CONNECTION_OPEN_OK));
        pool.setConnected(true);
        demux.maybeReleaseBuffersOnChannel(0);
        logger.info("Logged in to vhost '{}' (channel-max={}, frame-max={})",
                opts.getVhost(), pool.getChannelMax(), frameMax);
    }

    private static void checkFrameMax(int frameMax) {
        if (frameMax != 0 && frameMax < AmqpConstants.MIN_FRAME_MAX) {
            throw new AmqpProtocolException("Frame max " + frameMax + " is below the protocol minimum of "
                    + AmqpConstants.MIN_FRAME_MAX);
        }
    }

    // Zero means "no limit" on either side
    private static int negotiate(int client, int server) {
        if (client == 0) {
            return server;
        }
        if (server == 0) {
            return client;
        }
        return Math.min(client, server);
    }

    private static Map<String, Object> clientProperties() {
        Map<String, Object> capabilities = new LinkedHashMap<>();
        capabilities.put("consumer_cancel_notify", true);
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("product", "simple-amqp-client");
        properties.put("platform", "Java");
        properties.put("capabilities", capabilities);
        return properties;
    }

    private void openChannel(int channel) {
        rpc.doRpcOnChannel(channel, AmqpMethod.CHANNEL_OPEN, MethodArgs.channelOpen(),
                EnumSet.of(AmqpMethod.CHANNEL_OPEN_OK));
        rpc.doRpcOnChannel(channel, AmqpMethod.CONFIRM_SELECT, MethodArgs.confirmSelect(),
                EnumSet.of(AmqpMethod.CONFIRM_SELECT_OK));
        confirms.reset(channel);
        demux.maybeReleaseBuffersOnChannel(channel);
    }

    // ===== Channels =====

    /**
     * Borrow a channel for a caller-driven sequence of operations.
     */
    public int getChannel() {
        ensureConnected();
        return pool.getChannel();
    }

    public void returnChannel(int channel) {
        pool.returnChannel(channel);
    }

    public boolean isChannelOpen(int channel) {
        return pool.isChannelOpen(channel);
    }

    /**
     * Close a channel from our side. Consumers on it are forgotten.
     */
    public void closeChannel(int channel) {
        ensureConnected();
        if (channel == 0 || !pool.isChannelOpen(channel)) {
            return;
        }
        try {
            rpc.doRpcOnChannel(channel, AmqpMethod.CHANNEL_CLOSE,
                    MethodArgs.close(AmqpConstants.REPLY_SUCCESS, "OK", 0, 0),
                    EnumSet.of(AmqpMethod.CHANNEL_CLOSE_OK));
            pool.channelClosed(channel);
        } finally {
            for (ConsumerRegistry.Consumer consumer : consumers.removeConsumersForChannel(channel)) {
                assembler.discardDelivered(consumer.getConsumerTag());
            }
            demux.discardBuffered(channel);
            demux.maybeReleaseBuffersOnChannel(channel);
        }
    }

    // ===== Publishing =====

    /**
     * Publish and wait for the broker's confirm.
     *
     * @throws com.simpleamqp.exception.MessageRejectedException if the broker nacks the message
     * @throws com.simpleamqp.exception.MessageReturnedException if a mandatory message cannot be routed
     */
    public void basicPublish(String exchange, String routingKey, Message message, boolean mandatory, boolean immediate) {
        int channel = basicPublishBegin(exchange, routingKey, message, mandatory, immediate);
        basicPublishEnd(channel);
    }

    public void basicPublish(String exchange, String routingKey, Message message) {
        basicPublish(exchange, routingKey, message, false, false);
    }

    /**
     * Send a publish without waiting for its confirm.
     *
     * @return a token to pass to {@link #basicPublishEnd(int)}
     */
    public int basicPublishBegin(String exchange, String routingKey, Message message,
                                 boolean mandatory, boolean immediate) {
        ensureConnected();
        int channel = pool.getChannel();
        try {
            rpc.sendMethod(channel, AmqpMethod.BASIC_PUBLISH,
                    MethodArgs.basicPublish(exchange, routingKey, mandatory, immediate));
            rpc.sendFrame(ContentHeader.encode(channel, message));

            byte[] body = message.getBody();
            int maxFragment = frameMax - AmqpConstants.FRAME_OVERHEAD;
            for (int offset = 0; offset < body.length; offset += maxFragment) {
                int length = Math.min(maxFragment, body.length - offset);
                rpc.sendFrame(AmqpFrame.body(channel, Unpooled.wrappedBuffer(body, offset, length)));
            }
        } catch (RuntimeException e) {
            pool.returnChannel(channel);
            throw e;
        }
        logger.debug("Published {} bytes to '{}' with routing key '{}' on channel {}",
                message.getBody().length, exchange, routingKey, channel);
        return channel;
    }

    /**
     * Wait for the confirm of a publish started with {@link #basicPublishBegin}.
     */
    public void basicPublishEnd(int token) {
        confirms.getAckOnChannel(token);
    }

    // ===== Consuming =====

    /**
     * Start a consumer on {@code queue}.
     *
     * @param consumerTag the tag to use, or empty to let the broker pick one
     * @return the consumer tag in effect
     */
    public String basicConsume(String queue, String consumerTag, boolean noLocal, boolean noAck,
                               boolean exclusive, Map<String, Object> arguments) {
        ensureConnected();
        int channel = pool.getChannel();
        try {
            AmqpFrame consumeOk = rpc.doRpcOnChannel(channel, AmqpMethod.BASIC_CONSUME,
                    MethodArgs.basicConsume(queue, consumerTag, noLocal, noAck, exclusive, arguments),
                    EnumSet.of(AmqpMethod.BASIC_CONSUME_OK));
            String tag = MethodArgs.decodeConsumerTag(consumeOk);
            consumers.addConsumer(tag, queue, channel, noAck);
            logger.info("Consuming from '{}' as {} on channel {}", queue, tag, channel);
            return tag;
        } finally {
            pool.returnChannel(channel);
            demux.maybeReleaseBuffersOnChannel(channel);
        }
    }

    public String basicConsume(String queue) {
        return basicConsume(queue, "", false, false, true, null);
    }

    /**
     * Next delivery for {@code consumerTag}.
     *
     * @param timeoutMillis how long to wait, or {@link FrameTransport#INFINITE}
     * @return the envelope, or empty if none arrived in time
     * @throws com.simpleamqp.exception.ConsumerTagNotFoundException if the tag is unknown
     * @throws ConsumerCancelledException if the broker cancelled the consumer
     */
    public Optional<Envelope> basicConsumeMessage(String consumerTag, long timeoutMillis) {
        ensureConnected();
        int channel = consumers.getConsumerChannel(consumerTag);
        Optional<Envelope> queued = assembler.pollDelivered(consumerTag);
        if (queued.isPresent()) {
            return queued;
        }
        if (!pool.isChannelOpen(channel)) {
            throw new IllegalStateException("Channel " + channel + " of consumer " + consumerTag + " is closed");
        }

        long deadline = timeoutMillis < 0 ? -1 : System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        try {
            while (true) {
                long remaining = deadline < 0
                        ? FrameTransport.INFINITE
                        : Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
                Optional<AmqpFrame> read = demux.getMethodOnChannel(channel, CONSUME_REPLIES, remaining);
                if (!read.isPresent()) {
                    return Optional.empty();
                }
                AmqpFrame frame = read.get();
                if (frame.isMethod(AmqpMethod.BASIC_CANCEL)) {
                    String cancelled = MethodArgs.decodeConsumerTag(frame);
                    if (consumers.hasConsumer(cancelled)) {
                        consumers.removeConsumer(cancelled);
                    }
                    logger.warn("Consumer {} cancelled by broker", cancelled);
                    throw new ConsumerCancelledException(cancelled);
                }

                MethodArgs.Deliver deliver = MethodArgs.decodeDeliver(frame);
                Message message = assembler.readContent(channel);
                Envelope envelope = new Envelope(message, deliver.getConsumerTag(), channel,
                        deliver.getDeliveryTag(), deliver.isRedelivered(), deliver.getExchange(),
                        deliver.getRoutingKey());
                if (deliver.getConsumerTag().equals(consumerTag)) {
                    return Optional.of(envelope);
                }
                assembler.enqueueDelivered(envelope);
            }
        } finally {
            demux.maybeReleaseBuffersOnChannel(channel);
        }
    }

    public Envelope basicConsumeMessage(String consumerTag) {
        return basicConsumeMessage(consumerTag, FrameTransport.INFINITE)
                .orElseThrow(() -> new IllegalStateException("No delivery without a timeout"));
    }

    /**
     * @throws IllegalStateException if the envelope's channel has been closed, or its consumer
     *                               was started with no-ack
     */
    public void basicAck(Envelope envelope) {
        checkAcknowledgeable(envelope);
        basicAck(envelope.getChannel(), envelope.getDeliveryTag(), false);
    }

    public void basicAck(int channel, long deliveryTag, boolean multiple) {
        ensureConnected();
        if (!pool.isChannelOpen(channel)) {
            throw new IllegalStateException("Cannot ack delivery " + deliveryTag + ", channel " + channel + " is closed");
        }
        rpc.sendMethod(channel, AmqpMethod.BASIC_ACK, MethodArgs.basicAck(deliveryTag, multiple));
    }

    public void basicReject(Envelope envelope, boolean requeue) {
        ensureConnected();
        checkAcknowledgeable(envelope);
        int channel = envelope.getChannel();
        if (!pool.isChannelOpen(channel)) {
            throw new IllegalStateException("Cannot reject delivery " + envelope.getDeliveryTag()
                    + ", channel " + channel + " is closed");
        }
        rpc.sendMethod(channel, AmqpMethod.BASIC_REJECT, MethodArgs.basicReject(envelope.getDeliveryTag(), requeue));
    }

    // No-ack deliveries are settled by the broker when sent
    private void checkAcknowledgeable(Envelope envelope) {
        if (consumers.isNoAckConsumer(envelope.getConsumerTag())) {
            throw new IllegalStateException("Delivery " + envelope.getDeliveryTag() + " of no-ack consumer "
                    + envelope.getConsumerTag() + " needs no acknowledgement");
        }
    }

    /**
     * Stop a consumer. Deliveries already received for it and not yet consumed are dropped.
     */
    public void basicCancel(String consumerTag) {
        ensureConnected();
        int channel = consumers.getConsumerChannel(consumerTag);
        try {
            if (pool.isChannelOpen(channel)) {
                rpc.doRpcOnChannel(channel, AmqpMethod.BASIC_CANCEL, MethodArgs.basicCancel(consumerTag),
                        EnumSet.of(AmqpMethod.BASIC_CANCEL_OK));
            }
        } finally {
            consumers.removeConsumer(consumerTag);
            assembler.discardDelivered(consumerTag);
            if (pool.getDirectReplyTag(channel).filter(consumerTag::equals).isPresent()) {
                pool.clearDirectReplyTag(channel);
            }
            demux.maybeReleaseBuffersOnChannel(channel);
        }
        logger.info("Cancelled consumer {}", consumerTag);
    }

    // ===== Direct reply-to =====

    /**
     * Make sure {@code channel} consumes from the direct reply-to pseudo-queue.
     * Does nothing if it already does.
     */
    public void maybeSubscribeToDirectReply(int channel) {
        ensureConnected();
        if (pool.getDirectReplyTag(channel).isPresent()) {
            return;
        }
        if (!pool.isChannelOpen(channel)) {
            throw new IllegalStateException("Channel " + channel + " is closed");
        }
        try {
            AmqpFrame consumeOk = rpc.doRpcOnChannel(channel, AmqpMethod.BASIC_CONSUME,
                    MethodArgs.basicConsume(AmqpConstants.DIRECT_REPLY_TO_QUEUE, "", true, true, true, null),
                    EnumSet.of(AmqpMethod.BASIC_CONSUME_OK));
            String tag = MethodArgs.decodeConsumerTag(consumeOk);
            pool.setDirectReplyTag(channel, tag);
            consumers.addConsumer(tag, AmqpConstants.DIRECT_REPLY_TO_QUEUE, channel, true);
            logger.debug("Channel {} subscribed to direct reply-to as {}", channel, tag);
        } finally {
            demux.maybeReleaseBuffersOnChannel(channel);
        }
    }

    /**
     * The direct reply-to consumer tag of {@code channel}, if it has subscribed.
     */
    public Optional<String> getDirectReplyToken(int channel) {
        return pool.getDirectReplyTag(channel);
    }

    // ===== Connection =====

    /**
     * Packed broker version, {@code major << 16 | minor << 8 | patch}, or 0 if the broker
     * did not report a three-part numeric version.
     */
    public int getBrokerVersion() {
        Object version = serverProperties.get(AmqpConstants.SERVER_VERSION_PROPERTY);
        return version instanceof String ? parseBrokerVersion((String) version) : 0;
    }

    static int parseBrokerVersion(String version) {
        if (version == null) {
            return 0;
        }
        Matcher matcher = VERSION_PATTERN.matcher(version);
        if (!matcher.matches()) {
            return 0;
        }
        try {
            int major = Integer.parseInt(matcher.group(1));
            int minor = Integer.parseInt(matcher.group(2));
            int patch = Integer.parseInt(matcher.group(3));
            return (major & 0xFF) << 16 | (minor & 0xFF) << 8 | (patch & 0xFF);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public Map<String, Object> getServerProperties() {
        return Collections.unmodifiableMap(serverProperties);
    }

    public int getFrameMax() {
        return frameMax;
    }

    public int getChannelMax() {
        return pool.getChannelMax();
    }

    public boolean isConnected() {
        return pool.isConnected();
    }

    /**
     * Acks received that did not advance a channel's delivery tag.
     */
    public long getStaleAckCount() {
        return confirms.getStaleAckCount();
    }

    /**
     * Close the connection. The transport is released even if the broker does not answer.
     */
    @Override
    public void close() {
        try {
            if (pool.isConnected()) {
                rpc.doRpcOnChannel(0, AmqpMethod.CONNECTION_CLOSE,
                        MethodArgs.close(AmqpConstants.REPLY_SUCCESS, "OK", 0, 0),
                        EnumSet.of(AmqpMethod.CONNECTION_CLOSE_OK));
                logger.info("Connection closed");
            }
        } finally {
            if (pool.isConnected()) {
                pool.connectionClosed();
            }
            consumers.clear();
            demux.releaseAll();
            transport.close();
        }
    }

    private void ensureConnected() {
        if (!pool.isConnected()) {
            throw ConnectionClosedException.notConnected();
        }
    }
}
