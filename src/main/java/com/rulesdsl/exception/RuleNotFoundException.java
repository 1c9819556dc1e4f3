package com.rulesdsl.exception;

/**
 * Exception thrown when a stored rule cannot be found by id.
 */
public class RuleNotFoundException extends RulesException {

    private final String ruleId;

    public RuleNotFoundException(String ruleId) {
        super("Rule not found: " + ruleId);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
