package com.rulesdsl.template;

import com.rulesdsl.dsl.RuleCategory;
import com.rulesdsl.dsl.RuleType;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only catalog of rule templates.
 */
public class RuleTemplateCatalog {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\[([A-Z_]+)]");

    private final List<RuleTemplate> templates;

    public RuleTemplateCatalog(List<RuleTemplate> templates) {
        this.templates = List.copyOf(templates);
    }

    public List<RuleTemplate> all() {
        return templates;
    }

    public List<RuleTemplate> byType(RuleType ruleType) {
        return templates.stream().filter(t -> t.ruleType() == ruleType).toList();
    }

    public List<RuleTemplate> byCategory(RuleCategory category) {
        return templates.stream().filter(t -> t.ruleCategory() == category).toList();
    }

    public Optional<RuleTemplate> byId(String id) {
        return templates.stream().filter(t -> t.id().equals(id)).findFirst();
    }

    /**
     * Distinct categories, in the order they first appear.
     */
    public List<RuleCategory> categories() {
        Set<RuleCategory> categories = new LinkedHashSet<>();
        templates.forEach(t -> categories.add(t.ruleCategory()));
        return List.copyOf(categories);
    }

    /**
     * Case-insensitive search over name, description and both template texts.
     */
    public List<RuleTemplate> search(String term) {
        String needle = term == null ? "" : term.toLowerCase(Locale.ROOT);
        return templates.stream()
                .filter(t -> containsIgnoreCase(t.name(), needle)
                        || containsIgnoreCase(t.description(), needle)
                        || containsIgnoreCase(t.conditionTemplate(), needle)
                        || containsIgnoreCase(t.outcomeTemplate(), needle))
                .toList();
    }

    /**
     * Replace every [KEY] occurrence with its value. Unknown placeholders are left as is.
     */
    public AppliedTemplate apply(RuleTemplate template, Map<String, String> replacements) {
        String condition = template.conditionTemplate();
        String outcome = template.outcomeTemplate();
        for (Map.Entry<String, String> entry : replacements.entrySet()) {
            String placeholder = "[" + entry.getKey() + "]";
            String value = entry.getValue() == null ? "" : entry.getValue();
            condition = condition.replace(placeholder, value);
            outcome = outcome.replace(placeholder, value);
        }
        return new AppliedTemplate(condition, outcome);
    }

    /**
     * Distinct placeholder names across both texts, first-seen order.
     */
    public List<String> placeholders(RuleTemplate template) {
        Set<String> names = new LinkedHashSet<>();
        collect(template.conditionTemplate(), names);
        collect(template.outcomeTemplate(), names);
        return List.copyOf(names);
    }

    public int size() {
        return templates.size();
    }

    private static void collect(String text, Set<String> names) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
    }

    private static boolean containsIgnoreCase(String text, String needle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(needle);
    }
}
