package io.biscuit.core;

/**
 * An internal invariant no longer holds (typically an interrupted tombstone purge).
 * <p>
 * Once raised the index refuses reads and writes until it is rebuilt.
 */
public final class InconsistentStateException extends BiscuitException {

    public InconsistentStateException(String message) {
        super(message);
    }

    public InconsistentStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
