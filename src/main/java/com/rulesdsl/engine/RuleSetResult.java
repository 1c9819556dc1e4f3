package com.rulesdsl.engine;

import com.rulesdsl.action.RuleMessage;

import java.util.List;
import java.util.Optional;

/**
 * Aggregated outcome of a product's active rules.
 *
 * @param outcomes Per-rule results, by priority descending then name
 * @param blocked  Whether any rule blocked
 * @param messages All messages, in outcome order
 */
public record RuleSetResult(List<RuleOutcome> outcomes, boolean blocked, List<RuleMessage> messages) {

    public RuleSetResult {
        outcomes = List.copyOf(outcomes);
        messages = List.copyOf(messages);
    }

    public static RuleSetResult of(List<RuleOutcome> outcomes) {
        boolean blocked = outcomes.stream().anyMatch(o -> o.result().isBlocked());
        List<RuleMessage> messages = outcomes.stream()
                .flatMap(o -> o.result().getMessages().stream())
                .toList();
        return new RuleSetResult(outcomes, blocked, messages);
    }

    public Optional<RuleOutcome> find(String ruleId) {
        return outcomes.stream().filter(o -> o.ruleId().equals(ruleId)).findFirst();
    }
}
