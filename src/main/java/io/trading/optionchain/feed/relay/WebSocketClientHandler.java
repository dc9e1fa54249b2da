package io.trading.optionchain.feed.relay;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Netty handler for the relay WebSocket.
 * Handles the handshake, text and control frames, and reports the close code to the owner.
 */
public class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClientHandler.class);

    /** Close code reported when the peer goes away without a close frame. */
    static final int ABNORMAL_CLOSURE = 1006;

    private static final int MAX_FRAME_PAYLOAD = 4 * 1024 * 1024;

    private final WebSocketClientHandshaker handshaker;
    private final Consumer<String> messageHandler;
    private final Consumer<Throwable> errorHandler;
    private final Runnable connectHandler;
    private final BiConsumer<Integer, String> closeHandler;

    private int closeCode = ABNORMAL_CLOSURE;
    private String closeReason = "connection lost";

    public WebSocketClientHandler(
        URI uri,
        Consumer<String> messageHandler,
        Consumer<Throwable> errorHandler,
        Runnable connectHandler,
        BiConsumer<Integer, String> closeHandler
    ) {
        this.handshaker = WebSocketClientHandshakerFactory.newHandshaker(
            uri,
            WebSocketVersion.V13,
            null,
            true,
            new DefaultHttpHeaders(),
            MAX_FRAME_PAYLOAD
        );
        this.messageHandler = messageHandler;
        this.errorHandler = errorHandler;
        this.connectHandler = connectHandler;
        this.closeHandler = closeHandler;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        LOGGER.debug("WebSocket channel inactive ({} {})", closeCode, closeReason);
        if (closeHandler != null) {
            closeHandler.accept(closeCode, closeReason);
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                LOGGER.debug("WebSocket handshake complete");
                if (connectHandler != null) {
                    connectHandler.run();
                }
            } catch (Exception e) {
                LOGGER.error("WebSocket handshake failed", e);
                if (errorHandler != null) {
                    errorHandler.accept(e);
                }
                ctx.close();
            }
            return;
        }

        if (msg instanceof FullHttpResponse response) {
            throw new IllegalStateException(
                "Unexpected FullHttpResponse (status=" + response.status() + ")"
            );
        }

        WebSocketFrame frame = (WebSocketFrame) msg;

        if (frame instanceof PingWebSocketFrame ping) {
            ctx.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            return;
        }

        if (frame instanceof TextWebSocketFrame textFrame) {
            if (messageHandler != null) {
                messageHandler.accept(textFrame.text());
            }
            return;
        }

        if (frame instanceof CloseWebSocketFrame closeFrame) {
            closeCode = closeFrame.statusCode();
            closeReason = closeFrame.reasonText();
            LOGGER.debug("Received close frame {} {}", closeCode, closeReason);
            ctx.close();
            return;
        }

        if (frame instanceof PongWebSocketFrame) {
            return;
        }

        LOGGER.warn("Unsupported frame type: {}", frame.getClass().getName());
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.error("WebSocket exception", cause);
        if (errorHandler != null) {
            errorHandler.accept(cause);
        }
        ctx.close();
    }
}
