package com.rulesdsl.action;

import com.rulesdsl.dsl.MessageSeverity;

/**
 * A message produced by a rule.
 *
 * @param message  Message text
 * @param severity Severity
 */
public record RuleMessage(String message, MessageSeverity severity) {

    public static RuleMessage info(String message) {
        return new RuleMessage(message, MessageSeverity.INFO);
    }

    public static RuleMessage error(String message) {
        return new RuleMessage(message, MessageSeverity.ERROR);
    }
}
