package io.trading.optionchain.feed.relay;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Netty-based WebSocket client for one relay session.
 * Each instance owns a single-threaded event loop group; a new instance is used per connect.
 */
public class WebSocketClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClient.class);

    private static final int CONNECT_TIMEOUT_MS = 10_000;

    private final URI uri;
    private final String name;
    private final Consumer<String> messageHandler;
    private final Consumer<Throwable> errorHandler;
    private final Runnable connectHandler;
    private final BiConsumer<Integer, String> closeHandler;

    private volatile EventLoopGroup eventLoopGroup;
    private volatile Channel channel;
    private volatile boolean connected = false;

    /**
     * Creates a new WebSocket client.
     *
     * @param uri            The WebSocket URI to connect to
     * @param name           Friendly name for this client (e.g., "Shard-1")
     * @param messageHandler Callback for received text messages
     * @param errorHandler   Callback for errors
     * @param connectHandler Callback when the handshake completes
     * @param closeHandler   Callback with close code and reason when the connection is lost
     */
    public WebSocketClient(
        URI uri,
        String name,
        Consumer<String> messageHandler,
        Consumer<Throwable> errorHandler,
        Runnable connectHandler,
        BiConsumer<Integer, String> closeHandler
    ) {
        this.uri = uri;
        this.name = name;
        this.messageHandler = messageHandler;
        this.errorHandler = errorHandler;
        this.connectHandler = connectHandler;
        this.closeHandler = closeHandler;
    }

    /**
     * Starts connecting to the WebSocket server and returns without waiting for the TCP connect.
     * Failures are reported to the error handler from the event loop.
     */
    public void connect() {
        if (connected) {
            LOGGER.warn("{}: Already connected", name);
            return;
        }

        try {
            boolean secure = "wss".equalsIgnoreCase(uri.getScheme());
            String host = uri.getHost();
            int port = uri.getPort() > 0 ? uri.getPort() : (secure ? 443 : 80);
            SslContext sslContext = secure ? SslContextBuilder.forClient().build() : null;

            eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(1);

            Bootstrap bootstrap = new Bootstrap();
            bootstrap.group(eventLoopGroup)
                .channel(NettyEventLoopFactory.getClientChannelClass())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .handler(new ChannelInitializer<>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        // published before the handshake can complete
                        channel = ch;
                        ChannelPipeline pipeline = ch.pipeline();

                        if (sslContext != null) {
                            pipeline.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        pipeline.addLast(new HttpClientCodec());
                        pipeline.addLast(new HttpObjectAggregator(8192));
                        pipeline.addLast(WebSocketClientCompressionHandler.INSTANCE);
                        pipeline.addLast(new WebSocketClientHandler(
                            uri,
                            messageHandler,
                            errorHandler,
                            () -> {
                                connected = true;
                                LOGGER.info("{}: Connected", name);
                                if (connectHandler != null) {
                                    connectHandler.run();
                                }
                            },
                            (code, reason) -> {
                                connected = false;
                                LOGGER.warn("{}: Disconnected ({} {})", name, code, reason);
                                if (closeHandler != null) {
                                    closeHandler.accept(code, reason);
                                }
                            }
                        ));
                    }
                });

            LOGGER.info("{}: Connecting to {}:{}...", name, host, port);
            bootstrap.connect(host, port).addListener((ChannelFutureListener) future -> {
                if (!future.isSuccess()) {
                    Throwable cause = future.cause();
                    LOGGER.error("{}: Failed to connect: {}", name, cause == null ? "cancelled" : cause.getMessage());
                    if (errorHandler != null && cause != null) {
                        errorHandler.accept(cause);
                    }
                    close();
                }
            });

        } catch (Exception e) {
            LOGGER.error("{}: Failed to connect: {}", name, e.getMessage());
            if (errorHandler != null) {
                errorHandler.accept(e);
            }
            close();
        }
    }

    /**
     * Sends a text message through the WebSocket.
     *
     * @param message The message to send
     * @return true if the frame was handed to the channel
     */
    public boolean send(String message) {
        Channel current = channel;
        if (!connected || current == null) {
            LOGGER.warn("{}: Cannot send message, not connected", name);
            return false;
        }
        current.writeAndFlush(new TextWebSocketFrame(message)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                // closing surfaces the failure through the close handler
                LOGGER.warn("{}: Write failed, closing channel: {}", name, future.cause().getMessage());
                future.channel().close();
            }
        });
        return true;
    }

    @Override
    public void close() {
        connected = false;

        Channel current = channel;
        channel = null;
        if (current != null) {
            ChannelFuture closeFuture = current.close();
            // never block the event loop that completes the future
            if (!current.eventLoop().inEventLoop()) {
                try {
                    closeFuture.sync();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOGGER.error("{}: Interrupted while closing channel", name, e);
                }
            }
        }

        EventLoopGroup group = eventLoopGroup;
        eventLoopGroup = null;
        if (group != null) {
            group.shutdownGracefully();
        }

        LOGGER.info("{}: Closed", name);
    }
}
