package com.escada.rentbot.transport;

/**
 * The recipient blocked the bot (HTTP 403). Permanent: the user must not be messaged again.
 */
public class RecipientBlockedException extends TransportException {

    public RecipientBlockedException(String message, Throwable cause) {
        super("403", message, cause);
    }
}
