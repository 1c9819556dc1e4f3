package com.rulesdsl.evaluation;

import com.rulesdsl.condition.ValueComparator;
import com.rulesdsl.core.EvaluationContext;
import com.rulesdsl.dsl.Condition;
import com.rulesdsl.variable.FieldPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation of ConditionEvaluator.
 */
public class DefaultConditionEvaluator implements ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DefaultConditionEvaluator.class);

    private final FieldPathResolver resolver;
    private final ValueComparator comparator;

    public DefaultConditionEvaluator(FieldPathResolver resolver, ValueComparator comparator) {
        this.resolver = resolver;
        this.comparator = comparator;
    }

    @Override
    public ConditionEvaluationResult evaluate(Condition condition, EvaluationContext context) {
        Object actual = resolver.resolveOrNull(condition.field(), context);
        Object expected = condition.value();
        boolean matched = comparator.compare(condition.operator(), actual, expected);

        log.trace("Condition {} (actual: {}) = {}", condition, actual, matched);
        return new ConditionEvaluationResult(condition, matched, actual, expected, condition.field());
    }
}
