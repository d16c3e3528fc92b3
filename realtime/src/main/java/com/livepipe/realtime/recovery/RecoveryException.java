package com.livepipe.realtime.recovery;

/**
 * A recovery strategy cannot be applied to the execution as it stands.
 */
public class RecoveryException extends RuntimeException {

    public RecoveryException(String message) {
        super(message);
    }
}
