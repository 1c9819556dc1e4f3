package com.rulesdsl.template;

/**
 * Template texts after placeholder substitution.
 */
public record AppliedTemplate(String condition, String outcome) {
}
