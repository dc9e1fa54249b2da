package io.trading.optionchain.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.trading.optionchain.upstream.ContractSelection;
import io.trading.optionchain.upstream.ExpiryMode;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration for the option chain recorder.
 *
 * @param underlyings              Underlying symbols to record (upper case)
 * @param samplingIntervalSeconds  Seconds between snapshots
 * @param flushRowsPerWrite        Buffered rows that force a flush
 * @param flushIntervalSeconds     Maximum seconds between flushes of a non-empty buffer
 * @param venueLabel               Venue written into every row (e.g., "NSE-FO")
 * @param fileVenueToken           Venue token used in output file names (e.g., "NSEFO")
 * @param timezone                 Exchange timezone for naive timestamps and file dates
 * @param reconnectMaxTries        Reconnect attempts per shard before it is exhausted
 * @param reconnectMaxDelaySeconds Cap on the reconnect backoff delay
 * @param outputDir                Directory receiving the CSV files
 * @param feedUrl                  WebSocket URL of the tick relay
 * @param universeFile             Pre-selected universe CSV (may be null when another provider is used)
 * @param spotPrices               Seed spot price per underlying
 * @param spotTokens               Index token per underlying used to refresh spot prices
 * @param marketOpen               Session open time in {@code timezone}
 * @param marketClose              Session close time in {@code timezone}
 * @param metricsPort              Port of the metrics/status HTTP server, 0 disables it
 * @param healthCheckMs            Health check interval in milliseconds
 * @param contractSelection        Expiry and strike filters applied to the universe file
 */
public record RecorderConfig(
    List<String> underlyings,
    double samplingIntervalSeconds,
    int flushRowsPerWrite,
    double flushIntervalSeconds,
    String venueLabel,
    String fileVenueToken,
    ZoneId timezone,
    int reconnectMaxTries,
    int reconnectMaxDelaySeconds,
    Path outputDir,
    URI feedUrl,
    Path universeFile,
    Map<String, Double> spotPrices,
    Map<String, Long> spotTokens,
    LocalTime marketOpen,
    LocalTime marketClose,
    int metricsPort,
    int healthCheckMs,
    ContractSelection contractSelection
) {
    public static final double DEFAULT_SAMPLING_INTERVAL_SECONDS = 1.0;
    public static final int DEFAULT_FLUSH_ROWS = 500;
    public static final double DEFAULT_FLUSH_INTERVAL_SECONDS = 1.0;
    public static final String DEFAULT_VENUE_LABEL = "NSE-FO";
    public static final String DEFAULT_FILE_VENUE_TOKEN = "NSEFO";
    public static final String DEFAULT_TIMEZONE = "Asia/Kolkata";
    public static final int DEFAULT_RECONNECT_MAX_TRIES = 50;
    public static final int DEFAULT_RECONNECT_MAX_DELAY_SECONDS = 30;
    public static final String DEFAULT_OUTPUT_DIR = "archive/option_chain";
    public static final String DEFAULT_FEED_URL = "ws://localhost:8765/ticks";
    public static final LocalTime DEFAULT_MARKET_OPEN = LocalTime.of(9, 15);
    public static final LocalTime DEFAULT_MARKET_CLOSE = LocalTime.of(15, 30);
    public static final int DEFAULT_METRICS_PORT = 9090;
    public static final int DEFAULT_HEALTH_CHECK_MS = 5000;

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public RecorderConfig {
        if (underlyings == null || underlyings.isEmpty()) {
            throw new ConfigurationException("underlyings cannot be null or empty");
        }
        if (underlyings.stream().anyMatch(Objects::isNull)) {
            throw new ConfigurationException("underlyings cannot contain null entries");
        }
        underlyings = underlyings.stream()
            .map(u -> u.trim().toUpperCase(Locale.ROOT))
            .filter(u -> !u.isEmpty())
            .distinct()
            .collect(Collectors.toUnmodifiableList());
        if (underlyings.isEmpty()) {
            throw new ConfigurationException("underlyings cannot be null or empty");
        }
        if (!(samplingIntervalSeconds > 0)) {
            throw new ConfigurationException("sampling_interval_seconds must be positive");
        }
        if (toMillis(samplingIntervalSeconds) < 1) {
            throw new ConfigurationException(
                "sampling_interval_seconds must be at least one millisecond: " + samplingIntervalSeconds);
        }
        if (flushRowsPerWrite <= 0) {
            throw new ConfigurationException("flush_rows_per_write must be positive");
        }
        if (!(flushIntervalSeconds > 0)) {
            throw new ConfigurationException("flush_interval_seconds must be positive");
        }
        if (toMillis(flushIntervalSeconds) < 1) {
            throw new ConfigurationException(
                "flush_interval_seconds must be at least one millisecond: " + flushIntervalSeconds);
        }
        if (venueLabel == null || venueLabel.isEmpty()) {
            throw new ConfigurationException("venue_label cannot be null or empty");
        }
        if (fileVenueToken == null || fileVenueToken.isEmpty()) {
            throw new ConfigurationException("file_venue_token cannot be null or empty");
        }
        if (timezone == null) {
            throw new ConfigurationException("timezone cannot be null");
        }
        if (reconnectMaxTries < 0) {
            throw new ConfigurationException("reconnect_max_tries cannot be negative");
        }
        if (reconnectMaxDelaySeconds <= 0) {
            throw new ConfigurationException("reconnect_max_delay must be positive");
        }
        if (outputDir == null) {
            throw new ConfigurationException("output_dir cannot be null");
        }
        if (feedUrl == null) {
            throw new ConfigurationException("feed_url cannot be null");
        }
        if (marketOpen == null || marketClose == null || !marketOpen.isBefore(marketClose)) {
            throw new ConfigurationException("market_open must be before market_close");
        }
        if (metricsPort < 0 || metricsPort > 65535) {
            throw new ConfigurationException("metrics_port must be between 0 and 65535");
        }
        if (healthCheckMs <= 0) {
            throw new ConfigurationException("health_check_ms must be positive");
        }
        if (contractSelection == null) {
            contractSelection = ContractSelection.defaults();
        }
        spotPrices = spotPrices == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(spotPrices));
        spotTokens = spotTokens == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(spotTokens));
    }

    public long samplingIntervalMillis() {
        return toMillis(samplingIntervalSeconds);
    }

    public long flushIntervalMillis() {
        return toMillis(flushIntervalSeconds);
    }

    private static long toMillis(double seconds) {
        return Math.round(seconds * 1000.0);
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables (keys are the upper-cased YAML keys):
     * - UNDERLYINGS: comma list (e.g., "NIFTY,BANKNIFTY"), required
     * - SAMPLING_INTERVAL_SECONDS, FLUSH_ROWS_PER_WRITE, FLUSH_INTERVAL_SECONDS
     * - VENUE_LABEL, FILE_VENUE_TOKEN, TIMEZONE
     * - RECONNECT_MAX_TRIES, RECONNECT_MAX_DELAY
     * - OUTPUT_DIR, FEED_URL, UNIVERSE_FILE
     * - SPOT_PRICES (e.g., "NIFTY:24010,BANKNIFTY:51200"), SPOT_TOKENS (e.g., "NIFTY:256265")
     * - MARKET_OPEN, MARKET_CLOSE (HH:mm), METRICS_PORT, HEALTH_CHECK_MS
     * - EXPIRIES_MODE (nearest, weekly, monthly, explicit_list), EXPIRY_LIST (yyyy-MM-dd list)
     * - MAX_STRIKE_DISTANCE, WEEKLY_EXPIRY_COUNT, MONTHLY_MIN_DAY, MONTHLY_EXPIRY_COUNT
     */
    public static RecorderConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    /**
     * Loads configuration from an environment-like lookup keyed by upper-case names.
     */
    public static RecorderConfig fromEnv(Function<String, String> env) {
        return fromLookup(key -> env.apply(key.toUpperCase(Locale.ROOT)));
    }

    /**
     * Loads configuration from a YAML file. Lists and maps are accepted for
     * underlyings, spot_prices and spot_tokens.
     */
    public static RecorderConfig fromYaml(Path path) {
        if (!Files.exists(path)) {
            throw new ConfigurationException("Config file not found: " + path);
        }
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read config file: " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Config file is not a mapping: " + path);
        }
        Map<String, String> flat = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            flat.put(field.getKey().toLowerCase(Locale.ROOT), flatten(field.getValue()));
        }
        return fromLookup(flat::get);
    }

    private static String flatten(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            List<String> items = new ArrayList<>();
            node.forEach(item -> items.add(item.asText()));
            return String.join(",", items);
        }
        if (node.isObject()) {
            List<String> pairs = new ArrayList<>();
            node.fields().forEachRemaining(e -> pairs.add(e.getKey() + ":" + e.getValue().asText()));
            return String.join(",", pairs);
        }
        return node.asText();
    }

    private static RecorderConfig fromLookup(Function<String, String> lookup) {
        String underlyingsStr = lookup.apply("underlyings");
        if (isBlank(underlyingsStr)) {
            throw new ConfigurationException("underlyings is required");
        }
        String universeFile = lookup.apply("universe_file");

        return new RecorderConfig(
            Arrays.stream(underlyingsStr.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList()),
            parseDouble(lookup, "sampling_interval_seconds", DEFAULT_SAMPLING_INTERVAL_SECONDS),
            parseInt(lookup, "flush_rows_per_write", DEFAULT_FLUSH_ROWS),
            parseDouble(lookup, "flush_interval_seconds", DEFAULT_FLUSH_INTERVAL_SECONDS),
            valueOr(lookup, "venue_label", DEFAULT_VENUE_LABEL),
            valueOr(lookup, "file_venue_token", DEFAULT_FILE_VENUE_TOKEN),
            parseZone(valueOr(lookup, "timezone", DEFAULT_TIMEZONE)),
            parseInt(lookup, "reconnect_max_tries", DEFAULT_RECONNECT_MAX_TRIES),
            parseInt(lookup, "reconnect_max_delay", DEFAULT_RECONNECT_MAX_DELAY_SECONDS),
            Paths.get(valueOr(lookup, "output_dir", DEFAULT_OUTPUT_DIR)),
            parseUri(valueOr(lookup, "feed_url", DEFAULT_FEED_URL)),
            isBlank(universeFile) ? null : Paths.get(universeFile.trim()),
            parsePairs(lookup.apply("spot_prices"), "spot_prices", Double::parseDouble),
            parsePairs(lookup.apply("spot_tokens"), "spot_tokens", Long::parseLong),
            parseTime(lookup, "market_open", DEFAULT_MARKET_OPEN),
            parseTime(lookup, "market_close", DEFAULT_MARKET_CLOSE),
            parseInt(lookup, "metrics_port", DEFAULT_METRICS_PORT),
            parseInt(lookup, "health_check_ms", DEFAULT_HEALTH_CHECK_MS),
            parseSelection(lookup)
        );
    }

    private static ContractSelection parseSelection(Function<String, String> lookup) {
        ExpiryMode mode;
        try {
            mode = ExpiryMode.fromName(lookup.apply("expiries_mode"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid expiries_mode: " + lookup.apply("expiries_mode"), e);
        }
        List<LocalDate> expiries = new ArrayList<>();
        String expiryList = lookup.apply("expiry_list");
        if (!isBlank(expiryList)) {
            for (String item : expiryList.split(",")) {
                if (item.trim().isEmpty()) {
                    continue;
                }
                try {
                    expiries.add(LocalDate.parse(item.trim()));
                } catch (DateTimeException e) {
                    throw new ConfigurationException("Invalid expiry_list entry: " + item.trim(), e);
                }
            }
        }
        try {
            return new ContractSelection(
                mode,
                expiries,
                parseDouble(lookup, "max_strike_distance", ContractSelection.DEFAULT_MAX_STRIKE_DISTANCE),
                parseInt(lookup, "weekly_expiry_count", ContractSelection.DEFAULT_WEEKLY_EXPIRY_COUNT),
                parseInt(lookup, "monthly_min_day", ContractSelection.DEFAULT_MONTHLY_MIN_DAY),
                parseInt(lookup, "monthly_expiry_count", ContractSelection.DEFAULT_MONTHLY_EXPIRY_COUNT)
            );
        } catch (ConfigurationException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String valueOr(Function<String, String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        return isBlank(value) ? defaultValue : value.trim();
    }

    private static int parseInt(Function<String, String> lookup, String key, int defaultValue) {
        String value = lookup.apply(key);
        if (isBlank(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + key + " value: " + value, e);
        }
    }

    private static double parseDouble(Function<String, String> lookup, String key, double defaultValue) {
        String value = lookup.apply(key);
        if (isBlank(value)) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + key + " value: " + value, e);
        }
    }

    private static LocalTime parseTime(Function<String, String> lookup, String key, LocalTime defaultValue) {
        String value = lookup.apply(key);
        if (isBlank(value)) {
            return defaultValue;
        }
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid " + key + " value: " + value, e);
        }
    }

    private static ZoneId parseZone(String value) {
        try {
            return ZoneId.of(value);
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid timezone: " + value, e);
        }
    }

    private static URI parseUri(String value) {
        URI uri;
        try {
            uri = URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid feed_url: " + value, e);
        }
        if (!"ws".equals(uri.getScheme()) && !"wss".equals(uri.getScheme())) {
            throw new ConfigurationException("feed_url must be a ws:// or wss:// URL: " + value);
        }
        return uri;
    }

    /**
     * Parses "KEY:value,KEY:value" pairs; keys are upper-cased.
     */
    private static <T> Map<String, T> parsePairs(String value, String key, Function<String, T> parser) {
        Map<String, T> result = new LinkedHashMap<>();
        if (isBlank(value)) {
            return result;
        }
        for (String pair : value.split(",")) {
            String trimmed = pair.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] parts = trimmed.split(":");
            if (parts.length != 2) {
                throw new ConfigurationException("Invalid " + key + " entry: " + trimmed);
            }
            try {
                result.put(parts[0].trim().toUpperCase(Locale.ROOT), parser.apply(parts[1].trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid " + key + " entry: " + trimmed, e);
            }
        }
        return result;
    }

    /**
     * Creates a new builder for RecorderConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for RecorderConfig, mostly used by tests and embedding code.
     */
    public static class Builder {
        private final List<String> underlyings = new ArrayList<>();
        private double samplingIntervalSeconds = DEFAULT_SAMPLING_INTERVAL_SECONDS;
        private int flushRowsPerWrite = DEFAULT_FLUSH_ROWS;
        private double flushIntervalSeconds = DEFAULT_FLUSH_INTERVAL_SECONDS;
        private String venueLabel = DEFAULT_VENUE_LABEL;
        private String fileVenueToken = DEFAULT_FILE_VENUE_TOKEN;
        private ZoneId timezone = ZoneId.of(DEFAULT_TIMEZONE);
        private int reconnectMaxTries = DEFAULT_RECONNECT_MAX_TRIES;
        private int reconnectMaxDelaySeconds = DEFAULT_RECONNECT_MAX_DELAY_SECONDS;
        private Path outputDir = Paths.get(DEFAULT_OUTPUT_DIR);
        private URI feedUrl = URI.create(DEFAULT_FEED_URL);
        private Path universeFile;
        private final Map<String, Double> spotPrices = new LinkedHashMap<>();
        private final Map<String, Long> spotTokens = new LinkedHashMap<>();
        private LocalTime marketOpen = DEFAULT_MARKET_OPEN;
        private LocalTime marketClose = DEFAULT_MARKET_CLOSE;
        private int metricsPort = DEFAULT_METRICS_PORT;
        private int healthCheckMs = DEFAULT_HEALTH_CHECK_MS;
        private ContractSelection contractSelection = ContractSelection.defaults();

        public Builder addUnderlying(String underlying) {
            this.underlyings.add(underlying);
            return this;
        }

        public Builder samplingIntervalSeconds(double samplingIntervalSeconds) {
            this.samplingIntervalSeconds = samplingIntervalSeconds;
            return this;
        }

        public Builder flushRowsPerWrite(int flushRowsPerWrite) {
            this.flushRowsPerWrite = flushRowsPerWrite;
            return this;
        }

        public Builder flushIntervalSeconds(double flushIntervalSeconds) {
            this.flushIntervalSeconds = flushIntervalSeconds;
            return this;
        }

        public Builder venueLabel(String venueLabel) {
            this.venueLabel = venueLabel;
            return this;
        }

        public Builder fileVenueToken(String fileVenueToken) {
            this.fileVenueToken = fileVenueToken;
            return this;
        }

        public Builder timezone(ZoneId timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder reconnectMaxTries(int reconnectMaxTries) {
            this.reconnectMaxTries = reconnectMaxTries;
            return this;
        }

        public Builder reconnectMaxDelaySeconds(int reconnectMaxDelaySeconds) {
            this.reconnectMaxDelaySeconds = reconnectMaxDelaySeconds;
            return this;
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder feedUrl(URI feedUrl) {
            this.feedUrl = feedUrl;
            return this;
        }

        public Builder universeFile(Path universeFile) {
            this.universeFile = universeFile;
            return this;
        }

        public Builder spotPrice(String underlying, double spot) {
            this.spotPrices.put(underlying.toUpperCase(Locale.ROOT), spot);
            return this;
        }

        public Builder spotToken(String underlying, long token) {
            this.spotTokens.put(underlying.toUpperCase(Locale.ROOT), token);
            return this;
        }

        public Builder marketHours(LocalTime open, LocalTime close) {
            this.marketOpen = open;
            this.marketClose = close;
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            this.metricsPort = metricsPort;
            return this;
        }

        public Builder healthCheckMs(int healthCheckMs) {
            this.healthCheckMs = healthCheckMs;
            return this;
        }

        public Builder contractSelection(ContractSelection contractSelection) {
            this.contractSelection = contractSelection;
            return this;
        }

        public RecorderConfig build() {
            return new RecorderConfig(
                new ArrayList<>(underlyings),
                samplingIntervalSeconds,
                flushRowsPerWrite,
                flushIntervalSeconds,
                venueLabel,
                fileVenueToken,
                timezone,
                reconnectMaxTries,
                reconnectMaxDelaySeconds,
                outputDir,
                feedUrl,
                universeFile,
                spotPrices,
                spotTokens,
                marketOpen,
                marketClose,
                metricsPort,
                healthCheckMs,
                contractSelection
            );
        }
    }
}
