package com.rulesdsl.validation;

import com.rulesdsl.dsl.Action;
import com.rulesdsl.dsl.ActionType;
import com.rulesdsl.dsl.Condition;
import com.rulesdsl.dsl.ConditionGroup;
import com.rulesdsl.dsl.ConditionNode;
import com.rulesdsl.dsl.ConditionOperator;
import com.rulesdsl.dsl.RuleDraft;
import com.rulesdsl.dsl.RuleLogic;
import com.rulesdsl.dsl.RuleType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Checks a draft before it is saved.
 * Structural problems reject the draft; everything else is reported as a warning.
 */
public class RuleDraftValidator {

    static final int MAX_NAME_LENGTH = 200;
    static final int MIN_PRIORITY = 0;
    static final int MAX_PRIORITY = 100;

    public ValidationResult validate(RuleDraft draft) {
        List<String> warnings = new ArrayList<>();

        if (draft == null || draft.name() == null || draft.name().isBlank()) {
            return ValidationResult.invalid("Rule name is required", warnings);
        }
        RuleLogic logic = draft.logic();
        if (logic == null || logic.condition() == null || logic.condition().isEmpty()) {
            return ValidationResult.invalid("Rule must have at least one condition", warnings);
        }
        if (logic.thenActions().isEmpty()) {
            return ValidationResult.invalid("Rule must have at least one action", warnings);
        }

        if (draft.name().length() > MAX_NAME_LENGTH) {
            warnings.add("Rule name exceeds " + MAX_NAME_LENGTH + " characters");
        }
        if (draft.priority() < MIN_PRIORITY || draft.priority() > MAX_PRIORITY) {
            warnings.add("Priority should be between " + MIN_PRIORITY + " and " + MAX_PRIORITY);
        }
        if (draft.ruleType() != null && draft.ruleType() != RuleType.PRODUCT
                && (draft.targetId() == null || draft.targetId().isBlank())) {
            warnings.add(draft.ruleType().getWireName() + " rules should specify a target");
        }

        checkGroup(logic.condition(), warnings);
        checkActions(logic.thenActions(), "then", warnings);
        if (logic.elseActions() != null) {
            checkActions(logic.elseActions(), "else", warnings);
        }

        return ValidationResult.valid(warnings);
    }

    private void checkGroup(ConditionGroup group, List<String> warnings) {
        for (ConditionNode node : group.conditions()) {
            switch (node.nodeType()) {
                case GROUP -> checkGroup((ConditionGroup) node, warnings);
                case LEAF -> checkCondition((Condition) node, warnings);
            }
        }
    }

    private void checkCondition(Condition condition, List<String> warnings) {
        String field = condition.field();
        if (field == null || field.isBlank()) {
            warnings.add("Condition is missing a field");
        }
        ConditionOperator operator = condition.operator();
        if (operator == null) {
            warnings.add("Condition on '" + field + "' is missing an operator");
            return;
        }
        Object value = condition.value();
        if (operator.requiresValue() && value == null) {
            warnings.add("Condition on '" + field + "' requires a value for " + operator.getWireName());
            return;
        }
        switch (operator) {
            case BETWEEN -> {
                if (!isNumericPair(value)) {
                    warnings.add("Condition on '" + field + "' needs two numeric bounds for between");
                }
            }
            case IN, NOT_IN -> {
                if (!(value instanceof Collection<?>)) {
                    warnings.add("Condition on '" + field + "' needs a list value for " + operator.getWireName());
                }
            }
            default -> {
            }
        }
    }

    private void checkActions(List<Action> actions, String branch, List<String> warnings) {
        for (Action action : actions) {
            ActionType type = action.type();
            if (type == null) {
                warnings.add("Action in " + branch + " branch is missing a type");
                continue;
            }
            if (type.isMessaging()) {
                if (action.message() == null || action.message().isBlank()) {
                    warnings.add(type.getWireName() + " action in " + branch + " branch has no message");
                }
            } else if (action.target() == null || action.target().isBlank()) {
                warnings.add(type.getWireName() + " action in " + branch + " branch has no target");
            }
        }
    }

    private static boolean isNumericPair(Object value) {
        if (!(value instanceof List<?> list) || list.size() != 2) {
            return false;
        }
        for (Object bound : list) {
            if (!(bound instanceof Number) && !isNumericString(bound)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isNumericString(Object value) {
        if (!(value instanceof String s)) {
            return false;
        }
        try {
            Double.parseDouble(s.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
