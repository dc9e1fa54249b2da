package io.trading.optionchain.feed.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.optionchain.model.DepthLevel;
import io.trading.optionchain.model.Tick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decodes relay text frames into ticks.
 *
 * <p>A frame is either one tick object or an array of them:
 * <pre>
 * {"instrument_token":111,"last_price":101.5,"last_traded_quantity":75,
 *  "exchange_timestamp":"2025-01-02 09:15:01",
 *  "depth":{"buy":[{"price":100.0,"quantity":50}],"sell":[{"price":101.0,"quantity":40}]}}
 * </pre>
 * Objects without {@code instrument_token} are rejected; objects carrying only a
 * {@code type} field are relay control messages and are skipped.
 */
public class RelayTickDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayTickDecoder.class);

    private static final DateTimeFormatter EXCHANGE_TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ObjectMapper mapper;
    private final AtomicLong rejectedTicks = new AtomicLong(0);

    public RelayTickDecoder() {
        this(new ObjectMapper());
    }

    public RelayTickDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Decodes one frame.
     *
     * @param payload Frame text
     * @return Decoded ticks, empty for control messages
     * @throws JsonProcessingException if the frame is not valid JSON
     */
    public List<Tick> decode(String payload) throws JsonProcessingException {
        JsonNode root = mapper.readTree(payload);
        if (root == null || root.isMissingNode() || root.isNull()) {
            return Collections.emptyList();
        }
        if (root.isArray()) {
            List<Tick> ticks = new ArrayList<>(root.size());
            for (JsonNode node : root) {
                Tick tick = decodeTick(node);
                if (tick != null) {
                    ticks.add(tick);
                }
            }
            return ticks;
        }
        Tick tick = decodeTick(root);
        return tick == null ? Collections.emptyList() : List.of(tick);
    }

    private Tick decodeTick(JsonNode node) {
        if (!node.isObject()) {
            reject("not an object");
            return null;
        }
        JsonNode tokenNode = node.get("instrument_token");
        if (tokenNode == null || tokenNode.isNull()) {
            if (node.has("type")) {
                LOGGER.debug("Skipping relay control message: {}", node.get("type").asText());
            } else {
                reject("missing instrument_token");
            }
            return null;
        }
        if (!tokenNode.canConvertToLong() || tokenNode.asLong() <= 0) {
            reject("invalid instrument_token " + tokenNode.asText());
            return null;
        }

        Long lastQuantity = longOrNull(node.get("last_traded_quantity"));
        if (lastQuantity == null) {
            lastQuantity = longOrNull(node.get("last_quantity"));
        }

        List<DepthLevel> buy = List.of();
        List<DepthLevel> sell = List.of();
        JsonNode depth = node.get("depth");
        if (depth != null && depth.isObject()) {
            buy = levels(depth.get("buy"));
            sell = levels(depth.get("sell"));
        }

        return new Tick(
            tokenNode.asLong(),
            doubleOrNull(node.get("last_price")),
            lastQuantity,
            timestamp(node.get("exchange_timestamp")),
            buy,
            sell
        );
    }

    private static List<DepthLevel> levels(JsonNode side) {
        if (side == null || !side.isArray()) {
            return List.of();
        }
        List<DepthLevel> levels = new ArrayList<>(side.size());
        for (JsonNode level : side) {
            if (level == null || level.isNull() || !level.isObject()) {
                // kept as null so the row builder can flag the tick as malformed
                levels.add(null);
                continue;
            }
            levels.add(new DepthLevel(doubleOrNull(level.get("price")), longOrNull(level.get("quantity"))));
        }
        return levels;
    }

    private static Double doubleOrNull(JsonNode node) {
        if (node == null || node.isNull() || !(node.isNumber() || node.isTextual())) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        try {
            return Double.parseDouble(node.asText());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long longOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.longValue();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static LocalDateTime timestamp(JsonNode node) {
        if (node == null || !node.isTextual() || node.asText().isEmpty()) {
            return null;
        }
        String text = node.asText();
        try {
            if (text.indexOf('T') > 0) {
                return LocalDateTime.parse(text);
            }
            return LocalDateTime.parse(text, EXCHANGE_TS);
        } catch (DateTimeParseException e) {
            LOGGER.debug("Unparseable exchange_timestamp '{}'", text);
            return null;
        }
    }

    private void reject(String reason) {
        rejectedTicks.incrementAndGet();
        LOGGER.debug("Rejected relay tick: {}", reason);
    }

    /**
     * Tick objects dropped because they could not be turned into a tick.
     */
    public long getRejectedTicks() {
        return rejectedTicks.get();
    }
}
