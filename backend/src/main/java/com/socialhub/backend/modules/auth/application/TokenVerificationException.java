package com.socialhub.backend.modules.auth.application;

/**
 * Raised by {@link TokenService#verify} with the category of the failure.
 */
public class TokenVerificationException extends RuntimeException {

    public enum Failure {
        INVALID_SIGNATURE,
        MALFORMED,
        EXPIRED
    }

    private final Failure failure;

    public TokenVerificationException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public Failure getFailure() {
        return failure;
    }
}
