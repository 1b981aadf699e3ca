package com.edudata.authservice.exception;

/**
 * Storage failure in the challenge store. Surfaced to clients as a generic 500 and
 * never retried within the request, since a retry could issue a second challenge.
 */
public class ChallengePersistenceException extends RuntimeException {

    public ChallengePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
