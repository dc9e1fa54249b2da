package io.trading.optionchain.config;

import io.trading.optionchain.upstream.ExpiryMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecorderConfigTest {

    @TempDir
    Path dir;

    @Test
    void testDefaultsFromEnv() {
        RecorderConfig config = RecorderConfig.fromEnv(Map.of("UNDERLYINGS", "nifty, BANKNIFTY,NIFTY")::get);

        assertEquals(List.of("NIFTY", "BANKNIFTY"), config.underlyings());
        assertEquals(1000, config.samplingIntervalMillis());
        assertEquals(500, config.flushRowsPerWrite());
        assertEquals(1000, config.flushIntervalMillis());
        assertEquals("NSE-FO", config.venueLabel());
        assertEquals("NSEFO", config.fileVenueToken());
        assertEquals(ZoneId.of("Asia/Kolkata"), config.timezone());
        assertEquals(50, config.reconnectMaxTries());
        assertEquals(30, config.reconnectMaxDelaySeconds());
        assertEquals(Paths.get("archive/option_chain"), config.outputDir());
        assertEquals(URI.create("ws://localhost:8765/ticks"), config.feedUrl());
        assertNull(config.universeFile());
        assertEquals(LocalTime.of(9, 15), config.marketOpen());
        assertEquals(LocalTime.of(15, 30), config.marketClose());
        assertEquals(9090, config.metricsPort());
        assertEquals(ExpiryMode.NEAREST, config.contractSelection().expiryMode());
    }

    @Test
    void testFromEnvOverrides() {
        Map<String, String> env = new HashMap<>();
        env.put("UNDERLYINGS", "NIFTY");
        env.put("SAMPLING_INTERVAL_SECONDS", "0.5");
        env.put("FLUSH_ROWS_PER_WRITE", "100");
        env.put("TIMEZONE", "UTC");
        env.put("FEED_URL", "wss://relay.example.com/ticks");
        env.put("SPOT_PRICES", "nifty:24010.5, BANKNIFTY:51200");
        env.put("SPOT_TOKENS", "NIFTY:256265");
        env.put("EXPIRIES_MODE", "weekly");
        env.put("WEEKLY_EXPIRY_COUNT", "2");
        env.put("MAX_STRIKE_DISTANCE", "1000");

        RecorderConfig config = RecorderConfig.fromEnv(env::get);

        assertEquals(500, config.samplingIntervalMillis());
        assertEquals(100, config.flushRowsPerWrite());
        assertEquals(ZoneId.of("UTC"), config.timezone());
        assertEquals("wss", config.feedUrl().getScheme());
        assertEquals(Map.of("NIFTY", 24010.5, "BANKNIFTY", 51200.0), config.spotPrices());
        assertEquals(Map.of("NIFTY", 256265L), config.spotTokens());
        assertEquals(ExpiryMode.WEEKLY, config.contractSelection().expiryMode());
        assertEquals(2, config.contractSelection().weeklyExpiryCount());
        assertEquals(1000, config.contractSelection().maxStrikeDistance());
    }

    @Test
    void testUnderlyingsRequired() {
        assertThrows(ConfigurationException.class, () -> RecorderConfig.fromEnv(Map.<String, String>of()::get));
        assertThrows(ConfigurationException.class, () -> RecorderConfig.fromEnv(Map.of("UNDERLYINGS", " , ")::get));
    }

    @Test
    void testInvalidValuesRejected() {
        assertInvalid(Map.of("UNDERLYINGS", "NIFTY", "SAMPLING_INTERVAL_SECONDS", "0"));
        assertInvalid(Map.of("UNDERLYINGS", "NIFTY", "FLUSH_ROWS_PER_WRITE", "many"));
        assertInvalid(Map.of("UNDERLYINGS", "NIFTY", "TIMEZONE", "Mars/Olympus"));
        assertInvalid(Map.of("UNDERLYINGS", "NIFTY", "FEED_URL", "http://localhost/ticks"));
        assertInvalid(Map.of("UNDERLYINGS", "NIFTY", "SPOT_PRICES", "NIFTY=24000"));
        assertInvalid(Map.of("UNDERLYINGS", "NIFTY", "MARKET_OPEN", "16:00"));
        assertInvalid(Map.of("UNDERLYINGS", "NIFTY", "METRICS_PORT", "70000"));
        assertInvalid(Map.of("UNDERLYINGS", "NIFTY", "EXPIRIES_MODE", "quarterly"));
        assertInvalid(Map.of("UNDERLYINGS", "NIFTY", "EXPIRIES_MODE", "explicit_list"));
        assertInvalid(Map.of("UNDERLYINGS", "NIFTY", "EXPIRY_LIST", "2025-13-01"));
    }

    @Test
    void testSubMillisecondIntervalsRejected() {
        assertInvalid(Map.of("UNDERLYINGS", "NIFTY", "SAMPLING_INTERVAL_SECONDS", "0.0001"));
        assertInvalid(Map.of("UNDERLYINGS", "NIFTY", "FLUSH_INTERVAL_SECONDS", "0.0004"));

        RecorderConfig config = RecorderConfig.fromEnv(
            Map.of("UNDERLYINGS", "NIFTY", "SAMPLING_INTERVAL_SECONDS", "0.0005")::get);
        assertEquals(1, config.samplingIntervalMillis());
    }

    private static void assertInvalid(Map<String, String> env) {
        assertThrows(ConfigurationException.class, () -> RecorderConfig.fromEnv(env::get), env.toString());
    }

    @Test
    void testFromYaml() throws Exception {
        Path file = dir.resolve("recorder.yaml");
        Files.writeString(file, String.join("\n",
            "underlyings:",
            "  - NIFTY",
            "  - BANKNIFTY",
            "sampling_interval_seconds: 2",
            "output_dir: /data/option_chain",
            "universe_file: /data/instruments.csv",
            "spot_prices:",
            "  NIFTY: 24010",
            "spot_tokens:",
            "  NIFTY: 256265",
            "  BANKNIFTY: 260105",
            "expiries_mode: explicit_list",
            "expiry_list: [\"2025-01-30\", \"2025-02-27\"]",
            "metrics_port: 0",
            ""));

        RecorderConfig config = RecorderConfig.fromYaml(file);

        assertEquals(List.of("NIFTY", "BANKNIFTY"), config.underlyings());
        assertEquals(2000, config.samplingIntervalMillis());
        assertEquals(Paths.get("/data/option_chain"), config.outputDir());
        assertEquals(Paths.get("/data/instruments.csv"), config.universeFile());
        assertEquals(Map.of("NIFTY", 24010.0), config.spotPrices());
        assertEquals(List.of("NIFTY", "BANKNIFTY"), List.copyOf(config.spotTokens().keySet()));
        assertEquals(ExpiryMode.EXPLICIT_LIST, config.contractSelection().expiryMode());
        assertEquals(List.of(LocalDate.of(2025, 1, 30), LocalDate.of(2025, 2, 27)),
            config.contractSelection().explicitExpiries());
        assertEquals(0, config.metricsPort());
    }

    @Test
    void testMissingYamlFile() {
        assertThrows(ConfigurationException.class, () -> RecorderConfig.fromYaml(dir.resolve("missing.yaml")));
    }

    @Test
    void testYamlMustBeMapping() throws Exception {
        Path file = dir.resolve("list.yaml");
        Files.writeString(file, "- NIFTY\n- BANKNIFTY\n");

        assertThrows(ConfigurationException.class, () -> RecorderConfig.fromYaml(file));
    }

    @Test
    void testBuilder() {
        RecorderConfig config = RecorderConfig.builder()
            .addUnderlying("nifty")
            .samplingIntervalSeconds(0.25)
            .spotPrice("nifty", 24000)
            .spotToken("nifty", 256265)
            .metricsPort(0)
            .build();

        assertEquals(List.of("NIFTY"), config.underlyings());
        assertEquals(250, config.samplingIntervalMillis());
        assertEquals(24000.0, config.spotPrices().get("NIFTY"));
        assertEquals(256265L, config.spotTokens().get("NIFTY"));
    }

    @Test
    void testBuilderRejectsEmptyUnderlyings() {
        assertThrows(ConfigurationException.class, () -> RecorderConfig.builder().build());
    }

    @Test
    void testBuilderRejectsNullUnderlying() {
        RecorderConfig.Builder builder = RecorderConfig.builder()
            .addUnderlying("NIFTY")
            .addUnderlying(null);

        ConfigurationException e = assertThrows(ConfigurationException.class, builder::build);
        assertTrue(e.getMessage().contains("null"));
    }
}
