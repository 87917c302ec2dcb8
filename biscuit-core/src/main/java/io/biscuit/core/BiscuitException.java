package io.biscuit.core;

/**
 * Root of every error raised by a Biscuit index.
 * <p>
 * All subclasses are unchecked. {@link InvalidPatternException} and
 * {@link UnknownRecordHandleException} leave the index untouched;
 * {@link ResourceExhaustedException} aborts one write;
 * {@link InconsistentStateException} disables the index until it is rebuilt.
 */
public abstract class BiscuitException extends RuntimeException {

    protected BiscuitException(String message, Throwable cause) {
        super(message, cause);
    }

    protected BiscuitException(String message) {
        super(message);
    }
}
