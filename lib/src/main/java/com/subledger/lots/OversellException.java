package com.subledger.lots;

public final class OversellException extends RuntimeException {
    public OversellException(String message) {
        super(message);
    }
}
