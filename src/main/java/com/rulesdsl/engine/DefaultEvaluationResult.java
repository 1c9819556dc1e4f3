package com.rulesdsl.engine;

import com.rulesdsl.action.ActionOutcome;
import com.rulesdsl.action.RuleMessage;
import com.rulesdsl.dsl.Action;
import com.rulesdsl.evaluation.ConditionEvaluationResult;
import com.rulesdsl.evaluation.GroupEvaluationResult;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default implementation of EvaluationResult.
 * Two results are equal when every field is structurally equal.
 */
public class DefaultEvaluationResult implements EvaluationResult {

    private final boolean matched;
    private final List<ConditionEvaluationResult> conditionResults;
    private final List<Action> applicableActions;
    private final List<RuleMessage> messages;
    private final boolean blocked;
    private final Map<String, Object> contextDelta;

    private DefaultEvaluationResult(boolean matched, List<ConditionEvaluationResult> conditionResults,
                                    List<Action> applicableActions, List<RuleMessage> messages,
                                    boolean blocked, Map<String, Object> contextDelta) {
        this.matched = matched;
        this.conditionResults = conditionResults;
        this.applicableActions = applicableActions;
        this.messages = messages;
        this.blocked = blocked;
        this.contextDelta = contextDelta;
    }

    @Override
    public boolean isMatched() {
        return matched;
    }

    @Override
    public List<ConditionEvaluationResult> getConditionResults() {
        return conditionResults;
    }

    @Override
    public List<Action> getApplicableActions() {
        return applicableActions;
    }

    @Override
    public List<RuleMessage> getMessages() {
        return messages;
    }

    @Override
    public boolean isBlocked() {
        return blocked;
    }

    @Override
    public Map<String, Object> getContextDelta() {
        return contextDelta;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DefaultEvaluationResult that)) return false;
        return matched == that.matched
                && blocked == that.blocked
                && conditionResults.equals(that.conditionResults)
                && applicableActions.equals(that.applicableActions)
                && messages.equals(that.messages)
                && contextDelta.equals(that.contextDelta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(matched, conditionResults, applicableActions, messages, blocked, contextDelta);
    }

    @Override
    public String toString() {
        return "EvaluationResult{" +
                "matched=" + matched +
                ", blocked=" + blocked +
                ", conditions=" + conditionResults.size() +
                ", actions=" + applicableActions +
                ", messages=" + messages +
                ", contextDelta=" + contextDelta +
                '}';
    }

    /**
     * Assemble a result from the group trace and the action outcome.
     */
    public static EvaluationResult of(GroupEvaluationResult group, ActionOutcome outcome) {
        return new DefaultEvaluationResult(
                group.matched(),
                group.results(),
                outcome.actions(),
                outcome.messages(),
                outcome.blocked(),
                outcome.contextDelta());
    }
}
