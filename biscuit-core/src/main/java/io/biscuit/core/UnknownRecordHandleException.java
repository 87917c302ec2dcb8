package io.biscuit.core;

/**
 * Update or delete referencing a slot that is not live, or a handle whose
 * generation no longer matches the slot (the slot was recycled).
 */
public final class UnknownRecordHandleException extends BiscuitException {

    public UnknownRecordHandleException(String message) {
        super(message);
    }
}
