package com.rulesdsl.condition.impl;

import com.rulesdsl.condition.Comparison;
import com.rulesdsl.dsl.ConditionOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Regular expression search: true if the expected pattern is found anywhere in the actual string.
 * Both values must be strings. An invalid pattern evaluates to false.
 */
public class RegexComparison implements Comparison {

    private static final Logger log = LoggerFactory.getLogger(RegexComparison.class);

    @Override
    public boolean test(Object actual, Object expected) {
        if (!(actual instanceof String value) || !(expected instanceof String regex)) {
            return false;
        }

        Pattern pattern;
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            log.warn("Invalid regex pattern '{}', condition evaluates to false: {}", regex, e.getDescription());
            return false;
        }
        return pattern.matcher(value).find();
    }

    @Override
    public ConditionOperator getOperator() {
        return ConditionOperator.MATCHES;
    }

    @Override
    public String toString() {
        return "MATCHES";
    }
}
