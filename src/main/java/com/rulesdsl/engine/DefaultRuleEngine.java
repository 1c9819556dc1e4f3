package com.rulesdsl.engine;

import com.rulesdsl.action.ActionApplier;
import com.rulesdsl.action.ActionOutcome;
import com.rulesdsl.condition.DefaultValueComparator;
import com.rulesdsl.condition.ValueComparator;
import com.rulesdsl.core.EvaluationContext;
import com.rulesdsl.dsl.RuleLogic;
import com.rulesdsl.evaluation.ConditionGroupEvaluator;
import com.rulesdsl.evaluation.DefaultConditionEvaluator;
import com.rulesdsl.evaluation.GroupEvaluationResult;
import com.rulesdsl.variable.DefaultFieldPathResolver;
import com.rulesdsl.variable.FieldPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation of RuleEngine.
 * Evaluates the IF group, then selects and interprets the matching branch.
 */
public class DefaultRuleEngine implements RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultRuleEngine.class);

    private final ConditionGroupEvaluator groupEvaluator;
    private final ActionApplier actionApplier;

    public DefaultRuleEngine() {
        this(new DefaultFieldPathResolver(), new DefaultValueComparator());
    }

    public DefaultRuleEngine(FieldPathResolver resolver, ValueComparator comparator) {
        this.groupEvaluator = new ConditionGroupEvaluator(new DefaultConditionEvaluator(resolver, comparator));
        this.actionApplier = new ActionApplier(resolver);
        log.info("RuleEngine initialized with resolver {} and comparator {}",
                resolver.getClass().getSimpleName(), comparator.getClass().getSimpleName());
    }

    @Override
    public EvaluationResult evaluate(RuleLogic logic, EvaluationContext context) {
        EvaluationContext ctx = context != null ? context : EvaluationContext.empty();

        GroupEvaluationResult group = groupEvaluator.evaluate(logic.condition(), ctx);
        ActionOutcome outcome = actionApplier.selectAndApply(logic, group.matched(), ctx);

        log.debug("Rule evaluated for context {}: matched={}, conditions={}, actions={}, blocked={}",
                ctx.getContextId().orElse("-"), group.matched(), group.results().size(),
                outcome.actions().size(), outcome.blocked());

        return DefaultEvaluationResult.of(group, outcome);
    }
}
