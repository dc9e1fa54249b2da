package io.trading.optionchain.feed.relay;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for Netty event loop groups.
 * Uses epoll on Linux when the native transport is present, NIO elsewhere.
 */
public final class NettyEventLoopFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyEventLoopFactory.class);

    private static final boolean EPOLL_AVAILABLE = Epoll.isAvailable();

    static {
        LOGGER.info("Netty: using {} transport", EPOLL_AVAILABLE ? "native epoll" : "NIO");
    }

    private NettyEventLoopFactory() {
    }

    /**
     * Creates an EventLoopGroup with the specified number of threads.
     */
    public static EventLoopGroup createEventLoopGroup(int threads) {
        if (EPOLL_AVAILABLE) {
            return new EpollEventLoopGroup(threads);
        }
        return new NioEventLoopGroup(threads);
    }

    /**
     * Gets the SocketChannel class matching {@link #createEventLoopGroup(int)}.
     */
    public static Class<? extends SocketChannel> getClientChannelClass() {
        if (EPOLL_AVAILABLE) {
            return EpollSocketChannel.class;
        }
        return NioSocketChannel.class;
    }
}
