package com.madisonmentions.backend.common;

/**
 * Raised for malformed caller input (e.g. a reporter name shorter than two characters).
 * Controllers translate it into a 400 response.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
