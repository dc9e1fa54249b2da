package io.trading.optionchain.snapshot;

/**
 * A tick or contract could not be turned into a row.
 */
public class TransformException extends RuntimeException {

    private final long token;

    public TransformException(long token, String message) {
        super("token " + token + ": " + message);
        this.token = token;
    }

    public long getToken() {
        return token;
    }
}
