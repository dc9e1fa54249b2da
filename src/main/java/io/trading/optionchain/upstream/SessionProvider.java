package io.trading.optionchain.upstream;

/**
 * Supplies a valid broker session. Login and token refresh live behind this interface.
 */
@FunctionalInterface
public interface SessionProvider {

    /**
     * @return A session ready for streaming
     * @throws io.trading.optionchain.config.ConfigurationException if no valid session can be obtained
     */
    Session session();
}
