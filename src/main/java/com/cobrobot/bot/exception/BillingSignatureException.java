package com.cobrobot.bot.exception;

/**
 * A billing notification whose signature could not be verified. Nothing was claimed or changed.
 */
public class BillingSignatureException extends RuntimeException {

    public BillingSignatureException(String message) {
        super(message);
    }

    public BillingSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
