package com.claimflow.api;

/**
 * Thrown when a request body is missing a required field or carries the wrong type.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
