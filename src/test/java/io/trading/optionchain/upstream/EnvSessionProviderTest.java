package io.trading.optionchain.upstream;

import io.trading.optionchain.config.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvSessionProviderTest {

    @Test
    void testReadsSession() {
        Session session = new EnvSessionProvider(Map.of(
            "KITE_API_KEY", " key123 ",
            "KITE_ACCESS_TOKEN", "token456")::get).session();

        assertEquals("key123", session.apiKey());
        assertEquals("token456", session.accessToken());
    }

    @Test
    void testMissingVariables() {
        assertThrows(ConfigurationException.class,
            () -> new EnvSessionProvider(Map.of("KITE_API_KEY", "key")::get).session());
        assertThrows(ConfigurationException.class,
            () -> new EnvSessionProvider(Map.of("KITE_ACCESS_TOKEN", "token")::get).session());
    }

    @Test
    void testTokenMaskedInToString() {
        Session session = new Session("key123", "secret-token");

        assertFalse(session.toString().contains("secret-token"));
        assertTrue(session.toString().contains("key123"));
    }
}
