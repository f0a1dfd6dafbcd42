package com.assetdiffbot.core.checkout;

/**
 * Thrown when a git operation needed to materialize a revision fails.
 */
public class CheckoutException extends RuntimeException {

    public CheckoutException(String message) {
        super(message);
    }

    public CheckoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
