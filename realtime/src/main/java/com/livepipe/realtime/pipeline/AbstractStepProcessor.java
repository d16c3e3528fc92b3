package com.livepipe.realtime.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared checks for processors whose input is an upstream step's
 * {@code {data, metadata}} output.
 */
abstract class AbstractStepProcessor implements StepProcessor {

    protected static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    protected static ArrayNode requireDataArray(JsonNode input, String message) {
        if (input == null || !input.isObject() || !input.path("data").isArray()) {
            throw new StepInputException(message);
        }
        return (ArrayNode) input.get("data");
    }

    protected static ObjectNode requireMetadata(JsonNode input, String field, String message) {
        JsonNode metadata = input.path("metadata");
        if (!metadata.isObject() || metadata.path(field).isMissingNode() || metadata.path(field).isNull()) {
            throw new StepInputException(message);
        }
        return (ObjectNode) metadata;
    }

    protected static void requireObjects(ArrayNode records, String stepLabel) {
        for (int i = 0; i < records.size(); i++) {
            if (!records.get(i).isObject()) {
                throw new StepInputException(stepLabel + " step: Invalid record at index " + i);
            }
        }
    }

    /** JavaScript-style type name of a JSON value, as the UI displays it. */
    protected static String typeName(JsonNode value) {
        if (value.isTextual()) return "string";
        if (value.isNumber())  return "number";
        if (value.isBoolean()) return "boolean";
        return "object";
    }
}
