package com.rulesdsl.template;

import com.rulesdsl.dsl.RuleCategory;
import com.rulesdsl.dsl.RuleLogic;
import com.rulesdsl.dsl.RuleType;

import java.util.List;

/**
 * A reusable rule pattern with [PLACEHOLDER] texts.
 *
 * @param id                Template id
 * @param name              Display name
 * @param description       Short description
 * @param ruleType          Entity the rule applies to
 * @param ruleCategory      Business category
 * @param conditionTemplate IF text with placeholders
 * @param outcomeTemplate   THEN text with placeholders
 * @param exampleText       Sample plain English rule, may be null
 * @param tags              Free-form tags
 * @param builtIn           Whether the template ships with the application
 * @param defaultLogic      Starting logic, may be null
 */
public record RuleTemplate(
        String id,
        String name,
        String description,
        RuleType ruleType,
        RuleCategory ruleCategory,
        String conditionTemplate,
        String outcomeTemplate,
        String exampleText,
        List<String> tags,
        boolean builtIn,
        RuleLogic defaultLogic
) {

    public RuleTemplate {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
