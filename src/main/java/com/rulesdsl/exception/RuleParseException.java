package com.rulesdsl.exception;

/**
 * Exception thrown when a rule document cannot be read as DSL JSON.
 */
public class RuleParseException extends RulesException {

    public RuleParseException(String message) {
        super(message);
    }

    public RuleParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
