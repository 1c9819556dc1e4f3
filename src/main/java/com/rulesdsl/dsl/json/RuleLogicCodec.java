package com.rulesdsl.dsl.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.rulesdsl.dsl.ConditionNode;
import com.rulesdsl.dsl.RuleDraft;
import com.rulesdsl.dsl.RuleLogic;
import com.rulesdsl.exception.RuleParseException;

/**
 * Reads and writes the JSON wire format of rule logic and rule drafts.
 * Thread-safe once constructed.
 */
public class RuleLogicCodec {

    private final ObjectMapper objectMapper;

    public RuleLogicCodec() {
        this.objectMapper = createObjectMapper();
    }

    /**
     * Create an ObjectMapper that understands the DSL types.
     */
    public static ObjectMapper createObjectMapper() {
        SimpleModule module = new SimpleModule("rules-dsl");
        module.addDeserializer(ConditionNode.class, new ConditionNodeDeserializer());

        return new ObjectMapper()
                .registerModule(module)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    public RuleLogic read(String json) {
        return readValue(json, RuleLogic.class, "rule logic");
    }

    public String write(RuleLogic logic) {
        return writeValue(logic, false);
    }

    public RuleDraft readDraft(String json) {
        return readValue(json, RuleDraft.class, "rule draft");
    }

    public String writeDraft(RuleDraft draft) {
        return writeValue(draft, false);
    }

    /**
     * Write a draft with indentation, for prompts and logs.
     */
    public String writeDraftPretty(RuleDraft draft) {
        return writeValue(draft, true);
    }

    /**
     * Convert an already-parsed tree (e.g. a YAML map) into rule logic.
     */
    public RuleLogic fromTree(Object tree) {
        if (tree == null) {
            return null;
        }
        try {
            return objectMapper.convertValue(tree, RuleLogic.class);
        } catch (IllegalArgumentException e) {
            throw new RuleParseException("Invalid rule logic: " + e.getMessage(), e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    private <T> T readValue(String json, Class<T> type, String what) {
        if (json == null || json.isBlank()) {
            throw new RuleParseException("Cannot read " + what + " from empty input");
        }
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) {
                throw new RuleParseException("Cannot read " + what + " from JSON null");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new RuleParseException("Invalid " + what + " JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String writeValue(Object value, boolean pretty) {
        try {
            return pretty
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value)
                    : objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuleParseException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
