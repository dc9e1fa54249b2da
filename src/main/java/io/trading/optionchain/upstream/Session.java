package io.trading.optionchain.upstream;

/**
 * Broker session credentials used to open feed connections.
 *
 * @param apiKey      Application key
 * @param accessToken Session access token
 */
public record Session(String apiKey, String accessToken) {

    public Session {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey cannot be null or empty");
        }
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken cannot be null or empty");
        }
    }

    @Override
    public String toString() {
        return "Session[apiKey=" + apiKey + ", accessToken=***]";
    }
}
