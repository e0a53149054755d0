package com.subledger.engine;

/** Checked exception signalling that a subledger run could not complete. */
public final class SubledgerException extends Exception {
    public SubledgerException(String message) {
        super(message);
    }

    public SubledgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
