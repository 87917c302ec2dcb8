package io.biscuit.core;

/**
 * Memory ran out while growing index structures for a single write.
 * The write has been rolled back.
 */
public final class ResourceExhaustedException extends BiscuitException {

    public ResourceExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
