package com.rulesdsl.template;

import com.rulesdsl.dsl.ActionType;
import com.rulesdsl.dsl.Condition;
import com.rulesdsl.dsl.RuleCategory;
import com.rulesdsl.dsl.RuleType;
import com.rulesdsl.dsl.json.RuleLogicCodec;
import com.rulesdsl.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RuleTemplateCatalog and TemplateLoader.
 */
class RuleTemplateCatalogTest {

    private RuleLogicCodec codec;
    private RuleTemplateCatalog catalog;

    @BeforeEach
    void setUp() {
        codec = new RuleLogicCodec();
        catalog = new RuleTemplateCatalog(TemplateLoader.load("classpath:rule-templates.yaml", codec));
    }

    // =====================================================================
    // Loading
    // =====================================================================

    @Test
    @DisplayName("Built-in templates load from the classpath")
    void loadsBuiltIns() {
        assertEquals(20, catalog.size());
        assertTrue(catalog.all().stream().allMatch(RuleTemplate::builtIn));
    }

    @Test
    @DisplayName("Default logic is parsed when present")
    void defaultLogic() {
        RuleTemplate state = catalog.byId("eligibility-state").orElseThrow();

        assertNotNull(state.defaultLogic());
        assertEquals(ActionType.BLOCK, state.defaultLogic().thenActions().get(0).type());
        assertEquals(List.of("CA", "NY"),
                ((Condition) state.defaultLogic().condition().conditions().get(0)).value());
        assertEquals(List.of("state", "availability"), state.tags());
        assertNotNull(state.exampleText());
        assertNull(catalog.byId("eligibility-age").orElseThrow().defaultLogic());
        assertTrue(catalog.byId("eligibility-age").orElseThrow().tags().isEmpty());
    }

    @Test
    @DisplayName("Custom template files load from the file system")
    void loadsCustomFile() {
        List<RuleTemplate> templates = TemplateLoader.load("src/test/resources/templates/custom.yaml", codec);

        assertEquals(1, templates.size());
        assertFalse(templates.get(0).builtIn());
        assertEquals(RuleType.COVERAGE, templates.get(0).ruleType());
    }

    @Test
    @DisplayName("Invalid template files fail fast")
    void invalidFiles() {
        assertThrows(ConfigurationException.class,
                () -> TemplateLoader.load("classpath:templates/duplicate-ids.yaml", codec));
        assertThrows(ConfigurationException.class,
                () -> TemplateLoader.load("classpath:templates/bad-logic.yaml", codec));
        assertThrows(ConfigurationException.class,
                () -> TemplateLoader.load("classpath:templates/missing.yaml", codec));
    }

    @Test
    @DisplayName("Malformed YAML and non-mapping roots are configuration errors")
    void malformedYaml() {
        assertThrows(ConfigurationException.class, () -> TemplateLoader.parseYaml(yaml("- id: a\n- id: b\n"), codec));
        assertThrows(ConfigurationException.class, () -> TemplateLoader.parseYaml(yaml("templates: [\n  - id"), codec));
        assertThrows(ConfigurationException.class, () -> TemplateLoader.parseYaml(yaml(""), codec));
    }

    // =====================================================================
    // Queries
    // =====================================================================

    @Test
    @DisplayName("Templates filter by type and category")
    void filters() {
        assertEquals(4, catalog.byType(RuleType.FORMS).size());
        assertEquals(4, catalog.byCategory(RuleCategory.ELIGIBILITY).size());
        assertTrue(catalog.byId("nope").isEmpty());
    }

    @Test
    @DisplayName("Categories are distinct in declaration order")
    void categories() {
        assertEquals(List.of(RuleCategory.ELIGIBILITY, RuleCategory.PRICING, RuleCategory.COMPLIANCE,
                RuleCategory.COVERAGE, RuleCategory.FORMS), catalog.categories());
    }

    @Test
    @DisplayName("Search is case-insensitive over names, descriptions and texts")
    void search() {
        assertEquals(List.of("pricing-territory"),
                catalog.search("TERRITORY").stream().map(RuleTemplate::id).toList());
        assertEquals(List.of("eligibility-prior-loss"),
                catalog.search("underwriter/decline").stream().map(RuleTemplate::id).toList());
        assertTrue(catalog.search("earthquake").isEmpty());
        assertEquals(catalog.size(), catalog.search("").size());
    }

    // =====================================================================
    // Placeholders
    // =====================================================================

    @Test
    @DisplayName("Placeholders are distinct and in first-seen order")
    void placeholders() {
        RuleTemplate minimumLimit = catalog.byId("compliance-minimum-limit").orElseThrow();
        RuleTemplate age = catalog.byId("eligibility-age").orElseThrow();

        assertEquals(List.of("STATE_CODE", "MINIMUM_LIMIT"), catalog.placeholders(minimumLimit));
        assertEquals(List.of("MIN_AGE", "MAX_AGE"), catalog.placeholders(age));
    }

    @Test
    @DisplayName("Applying replaces every occurrence and leaves unknown placeholders")
    void apply() {
        RuleTemplate minimumLimit = catalog.byId("compliance-minimum-limit").orElseThrow();

        AppliedTemplate applied = catalog.apply(minimumLimit, Map.of("MINIMUM_LIMIT", "25,000"));

        assertEquals("State [STATE_CODE] requires minimum limit of $25,000", applied.condition());
        assertEquals("Limit must be at least $25,000 or coverage cannot be issued", applied.outcome());
    }

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
