package com.rulesdsl.exception;

/**
 * Exception thrown when configuration (templates, prompts, properties) is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends RulesException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
