package com.rulesdsl.template;

import com.rulesdsl.config.ResourceLocator;
import com.rulesdsl.dsl.RuleCategory;
import com.rulesdsl.dsl.RuleLogic;
import com.rulesdsl.dsl.RuleType;
import com.rulesdsl.dsl.json.RuleLogicCodec;
import com.rulesdsl.exception.ConfigurationException;
import com.rulesdsl.exception.RuleParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads rule templates from YAML files.
 */
public class TemplateLoader {

    private static final Logger log = LoggerFactory.getLogger(TemplateLoader.class);

    /**
     * Load templates from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path  Path to the templates file
     * @param codec Codec used for default logic
     * @return Templates in declaration order
     */
    public static List<RuleTemplate> load(String path, RuleLogicCodec codec) {
        log.info("Loading rule templates from: {}", path);

        Resource resource = ResourceLocator.getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream, codec);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load templates from: " + path, e);
        }
    }

    @SuppressWarnings("unchecked")
    static List<RuleTemplate> parseYaml(InputStream inputStream, RuleLogicCodec codec) {
        Object loaded;
        try {
            loaded = new Yaml().load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Template file is not valid YAML: " + e.getMessage(), e);
        }

        if (loaded == null) {
            throw new ConfigurationException("Template file is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Template file root must be a mapping");
        }

        Map<String, Object> root = (Map<String, Object>) loaded;

        Object section = root.get("templates");
        if (!(section instanceof List)) {
            throw new ConfigurationException("Template file must contain a 'templates' list");
        }

        List<RuleTemplate> templates = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (Object item : (List<Object>) section) {
            if (!(item instanceof Map)) {
                throw new ConfigurationException("Template entry must be a mapping: " + item);
            }
            RuleTemplate template = parseTemplate((Map<String, Object>) item, codec);
            if (!ids.add(template.id())) {
                throw new ConfigurationException("Duplicate template id: " + template.id());
            }
            templates.add(template);
        }

        log.info("Loaded {} rule templates", templates.size());
        return templates;
    }

    private static RuleTemplate parseTemplate(Map<String, Object> map, RuleLogicCodec codec) {
        String id = requireString(map, "id");
        try {
            return new RuleTemplate(
                    id,
                    requireString(map, "name"),
                    getString(map, "description", ""),
                    RuleType.fromWireName(requireString(map, "rule-type")),
                    RuleCategory.fromWireName(requireString(map, "rule-category")),
                    requireString(map, "condition-template"),
                    requireString(map, "outcome-template"),
                    getString(map, "example-text", null),
                    getStringList(map, "tags"),
                    getBoolean(map, "built-in", true),
                    parseDefaultLogic(map.get("default-logic"), codec));
        } catch (IllegalArgumentException | RuleParseException e) {
            throw new ConfigurationException("Invalid template '" + id + "': " + e.getMessage(), e);
        }
    }

    private static RuleLogic parseDefaultLogic(Object tree, RuleLogicCodec codec) {
        return tree == null ? null : codec.fromTree(tree);
    }

    private static String requireString(Map<String, Object> map, String key) {
        String value = getString(map, key, null);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Template is missing '" + key + "': " + map);
        }
        return value;
    }

    private static List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return List.of();
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'" + key + "' must be a list: " + value);
        }
        return list.stream().map(String::valueOf).toList();
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
