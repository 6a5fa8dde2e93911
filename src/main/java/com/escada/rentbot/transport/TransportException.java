package com.escada.rentbot.transport;

import java.util.Locale;

/**
 * A Telegram call failed. {@link #errorCode()} is the Bot API error code when there is one, or
 * the name of the underlying exception.
 */
public class TransportException extends Exception {
    private final String errorCode;

    public TransportException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public TransportException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    public String errorCode() {
        return errorCode;
    }

    /** Telegram answers 400 "message is not modified" when an edit changes nothing. */
    public boolean messageNotModified() {
        String msg = getMessage();
        return msg != null && msg.toLowerCase(Locale.ROOT).contains("message is not modified");
    }
}
