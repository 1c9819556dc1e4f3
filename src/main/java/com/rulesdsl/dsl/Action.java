package com.rulesdsl.dsl;

/**
 * An effect reported when a rule's conditions do (THEN) or do not (ELSE) match.
 *
 * @param type        Action type
 * @param target      Target field or entity (e.g. "eligibility", "pricing.factor", "forms.CP0010")
 * @param operator    How the value combines with the current target value
 * @param value       Value to apply
 * @param message     Message text, for ADD_MESSAGE and BLOCK
 * @param severity    Message severity
 * @param description Optional human-readable description
 */
public record Action(
        ActionType type,
        String target,
        ActionOperator operator,
        ActionValue value,
        String message,
        MessageSeverity severity,
        String description
) {

    public static Action block(String target, String message) {
        return new Action(ActionType.BLOCK, target, null, null, message, null, null);
    }

    public static Action addMessage(String message, MessageSeverity severity) {
        return new Action(ActionType.ADD_MESSAGE, "messages", null, null, message, severity, null);
    }

    public static Action set(String target, Object value) {
        return new Action(ActionType.SET, target, null, ActionValue.of(value), null, null, null);
    }

    public static Action set(String target, ActionOperator operator, Number value) {
        return new Action(ActionType.SET, target, operator, ActionValue.ofNumber(value), null, null, null);
    }

    public static Action of(ActionType type, String target, Object value) {
        return new Action(type, target, null, value == null ? null : ActionValue.of(value), null, null, null);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type == null ? "?" : type.getWireName());
        if (target != null) {
            sb.append(' ').append(target);
        }
        if (value != null) {
            sb.append(' ').append(operator == null ? "=" : operator.getWireName()).append(' ').append(value);
        }
        if (message != null) {
            sb.append(" \"").append(message).append('"');
        }
        return sb.toString();
    }
}
