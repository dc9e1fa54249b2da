package io.trading.optionchain.feed.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trading.optionchain.feed.FeedConnection;
import io.trading.optionchain.feed.FeedListener;
import io.trading.optionchain.model.Tick;
import io.trading.optionchain.upstream.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Feed connection over a WebSocket tick relay.
 *
 * <p>Control messages are JSON text: {@code {"a":"subscribe","v":[tokens]}} followed by
 * {@code {"a":"mode","v":["full",[tokens]]}}. Every connect uses a fresh
 * {@link WebSocketClient}; callbacks from a replaced or closed client are ignored.
 */
public class RelayFeedConnection implements FeedConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayFeedConnection.class);

    static final String MODE_FULL = "full";

    private final URI feedUrl;
    private final Session session;
    private final String name;
    private final ObjectMapper mapper;
    private final RelayTickDecoder decoder;

    private final AtomicLong decodeErrors = new AtomicLong(0);

    private volatile FeedListener listener;
    private WebSocketClient client;
    private volatile long generation = 0;

    public RelayFeedConnection(URI feedUrl, Session session, String name) {
        this.feedUrl = feedUrl;
        this.session = session;
        this.name = name;
        this.mapper = new ObjectMapper();
        this.decoder = new RelayTickDecoder(mapper);
    }

    @Override
    public void setListener(FeedListener listener) {
        this.listener = listener;
    }

    @Override
    public void connect(List<Long> tokens) {
        WebSocketClient fresh;
        long current;
        synchronized (this) {
            closeClient();
            current = ++generation;
            fresh = new WebSocketClient(
                sessionUri(feedUrl, session),
                name,
                message -> onMessage(current, message),
                error -> {
                    if (isCurrent(current) && listener != null) {
                        listener.onError(-1, String.valueOf(error.getMessage()));
                    }
                },
                () -> {
                    if (isCurrent(current) && listener != null) {
                        listener.onConnect();
                    }
                },
                (code, reason) -> {
                    if (isCurrent(current) && listener != null) {
                        listener.onClose(code, reason);
                    }
                }
            );
            client = fresh;
        }
        LOGGER.info("[{}] Opening relay session for {} tokens", name, tokens.size());
        fresh.connect();
    }

    @Override
    public void subscribeFull(List<Long> tokens) {
        WebSocketClient current;
        synchronized (this) {
            current = client;
        }
        if (current == null) {
            LOGGER.warn("[{}] Subscribe requested without an open session", name);
            return;
        }
        try {
            if (!current.send(subscribeMessage(tokens)) || !current.send(modeMessage(MODE_FULL, tokens))) {
                throw new IllegalStateException("Session closed before subscribing " + tokens.size() + " tokens");
            }
            LOGGER.info("[{}] Subscribed {} tokens in {} mode", name, tokens.size(), MODE_FULL);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode subscription", e);
        }
    }

    @Override
    public void close() {
        synchronized (this) {
            generation++;
            closeClient();
        }
    }

    private void closeClient() {
        if (client != null) {
            WebSocketClient previous = client;
            client = null;
            previous.close();
        }
    }

    private boolean isCurrent(long clientGeneration) {
        return clientGeneration == generation;
    }

    private void onMessage(long clientGeneration, String message) {
        if (!isCurrent(clientGeneration)) {
            return;
        }
        List<Tick> ticks;
        try {
            ticks = decoder.decode(message);
        } catch (JsonProcessingException e) {
            long errors = decodeErrors.incrementAndGet();
            LOGGER.warn("[{}] Undecodable frame ({} so far): {}", name, errors, e.getOriginalMessage());
            return;
        }
        FeedListener current = listener;
        if (!ticks.isEmpty() && current != null) {
            current.onTicks(ticks);
        }
    }

    String subscribeMessage(List<Long> tokens) throws JsonProcessingException {
        ObjectNode message = mapper.createObjectNode();
        message.put("a", "subscribe");
        ArrayNode values = message.putArray("v");
        for (Long token : tokens) {
            values.add(token.longValue());
        }
        return mapper.writeValueAsString(message);
    }

    String modeMessage(String mode, List<Long> tokens) throws JsonProcessingException {
        ObjectNode message = mapper.createObjectNode();
        message.put("a", "mode");
        ArrayNode values = message.putArray("v");
        values.add(mode);
        ArrayNode tokenArray = values.addArray();
        for (Long token : tokens) {
            tokenArray.add(token.longValue());
        }
        return mapper.writeValueAsString(message);
    }

    /**
     * Appends the session credentials as query parameters.
     */
    static URI sessionUri(URI base, Session session) {
        if (session == null) {
            return base;
        }
        String credentials = "api_key=" + encode(session.apiKey())
            + "&access_token=" + encode(session.accessToken());
        String uri = base.toString();
        String separator = base.getRawQuery() == null ? "?" : "&";
        return URI.create(uri + separator + credentials);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    @Override
    public long getDecodeErrors() {
        return decodeErrors.get();
    }

    @Override
    public long getRejectedTicks() {
        return decoder.getRejectedTicks();
    }
}
