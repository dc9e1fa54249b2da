package io.trading.optionchain.upstream;

import io.trading.optionchain.config.ConfigurationException;

import java.util.function.Function;

/**
 * Reads an already issued session from environment variables.
 */
public class EnvSessionProvider implements SessionProvider {

    public static final String API_KEY_ENV = "KITE_API_KEY";
    public static final String ACCESS_TOKEN_ENV = "KITE_ACCESS_TOKEN";

    private final Function<String, String> lookup;

    public EnvSessionProvider() {
        this(System::getenv);
    }

    public EnvSessionProvider(Function<String, String> lookup) {
        this.lookup = lookup;
    }

    @Override
    public Session session() {
        String apiKey = lookup.apply(API_KEY_ENV);
        String accessToken = lookup.apply(ACCESS_TOKEN_ENV);
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException(API_KEY_ENV + " is not set");
        }
        if (accessToken == null || accessToken.isBlank()) {
            throw new ConfigurationException(ACCESS_TOKEN_ENV + " is not set");
        }
        return new Session(apiKey.trim(), accessToken.trim());
    }
}
