package com.rulesdsl.action;

import com.rulesdsl.dsl.Action;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the selected branch of a rule amounts to.
 * The context delta keeps the order in which SET actions first touched each section.
 *
 * @param actions      Actions of the selected branch, in declaration order
 * @param messages     Messages from ADD_MESSAGE and BLOCK actions
 * @param blocked      Whether any BLOCK action was selected
 * @param contextDelta Intended context changes, keyed like the context; never applied by the engine
 */
public record ActionOutcome(
        List<Action> actions,
        List<RuleMessage> messages,
        boolean blocked,
        Map<String, Object> contextDelta
) {
    public ActionOutcome {
        actions = List.copyOf(actions);
        messages = List.copyOf(messages);
        contextDelta = Collections.unmodifiableMap(new LinkedHashMap<>(contextDelta));
    }
}
