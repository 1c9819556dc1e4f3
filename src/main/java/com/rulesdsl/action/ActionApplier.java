package com.rulesdsl.action;

import com.rulesdsl.core.EvaluationContext;
import com.rulesdsl.dsl.Action;
import com.rulesdsl.dsl.MessageSeverity;
import com.rulesdsl.dsl.RuleLogic;
import com.rulesdsl.variable.FieldPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects the THEN or ELSE branch of a rule and interprets its actions.
 * <p>
 * ADD_MESSAGE and BLOCK are interpreted here. Every other action type is only reported,
 * in declaration order, for the caller to apply to its own model. SET actions on context
 * paths additionally contribute to the context delta.
 */
public class ActionApplier {

    private static final Logger log = LoggerFactory.getLogger(ActionApplier.class);

    private final FieldPathResolver resolver;

    public ActionApplier(FieldPathResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Select and interpret the branch without a context. Arithmetic SET actions
     * produce no delta because there is no current value to combine with.
     */
    public ActionOutcome selectAndApply(RuleLogic logic, boolean matched) {
        return selectAndApply(logic, matched, null);
    }

    /**
     * Select and interpret the branch.
     *
     * @param logic   Rule logic
     * @param matched Whether the rule's condition matched
     * @param context Context used to read current values for arithmetic SET actions (may be null)
     * @return Actions, messages, blocked flag and context delta
     */
    public ActionOutcome selectAndApply(RuleLogic logic, boolean matched, EvaluationContext context) {
        List<Action> selected = matched ? logic.thenActions() : elseOrEmpty(logic);

        List<RuleMessage> messages = new ArrayList<>();
        ContextDeltaBuilder delta = new ContextDeltaBuilder(context, resolver);
        boolean blocked = false;

        for (Action action : selected) {
            if (action.type() == null) {
                log.warn("Skipping action without a type: {}", action);
                continue;
            }
            switch (action.type()) {
                case ADD_MESSAGE -> {
                    if (action.message() != null) {
                        MessageSeverity severity = action.severity() != null ? action.severity() : MessageSeverity.INFO;
                        messages.add(new RuleMessage(action.message(), severity));
                    }
                }
                case BLOCK -> {
                    blocked = true;
                    if (action.message() != null) {
                        messages.add(RuleMessage.error(action.message()));
                    }
                }
                case SET -> delta.record(action);
                default -> log.trace("Reporting {} action for caller: {}", action.type().getWireName(), action);
            }
        }

        return new ActionOutcome(selected, messages, blocked, delta.build());
    }

    private static List<Action> elseOrEmpty(RuleLogic logic) {
        return logic.elseActions() != null ? logic.elseActions() : List.of();
    }
}
