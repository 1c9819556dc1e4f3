package com.rulesdsl.exception;

/**
 * Base exception for the rules DSL library.
 */
public class RulesException extends RuntimeException {

    public RulesException(String message) {
        super(message);
    }

    public RulesException(String message, Throwable cause) {
        super(message, cause);
    }
}
