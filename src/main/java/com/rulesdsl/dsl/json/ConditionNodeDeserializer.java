package com.rulesdsl.dsl.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.rulesdsl.dsl.Condition;
import com.rulesdsl.dsl.ConditionGroup;
import com.rulesdsl.dsl.ConditionNode;

import java.io.IOException;

/**
 * Reads a condition tree element, choosing the variant by the properties present:
 * {@code op} + {@code conditions} is a group, {@code field} + {@code operator} is a leaf.
 */
public class ConditionNodeDeserializer extends StdDeserializer<ConditionNode> {

    public ConditionNodeDeserializer() {
        super(ConditionNode.class);
    }

    @Override
    public ConditionNode deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        ObjectCodec codec = parser.getCodec();
        JsonNode node = codec.readTree(parser);

        if (node == null || !node.isObject()) {
            throw JsonMappingException.from(parser, "Condition node must be a JSON object");
        }
        if (node.has("op") && node.has("conditions")) {
            return codec.treeToValue(node, ConditionGroup.class);
        }
        if (node.has("field") && node.has("operator")) {
            return codec.treeToValue(node, Condition.class);
        }
        throw JsonMappingException.from(parser,
                "Condition node must have either 'op' and 'conditions' or 'field' and 'operator': " + node);
    }
}
