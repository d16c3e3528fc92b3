package com.livepipe.realtime.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.livepipe.realtime.model.StepType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Takes the dataset's records as they are and describes them: record count
 * and the type of every field of the first record.
 */
@Component
public class ExtractStepProcessor extends AbstractStepProcessor {

    private static final Logger log = LoggerFactory.getLogger(ExtractStepProcessor.class);

    @Override
    public StepType type() {
        return StepType.EXTRACT;
    }

    @Override
    public void validateInput(JsonNode input) {
        if (input == null || !input.isArray()) {
            throw new StepInputException("Extract step requires input data to be an array");
        }
        if (input.isEmpty()) {
            throw new StepInputException("Extract step cannot process empty dataset");
        }
        if (!input.get(0).isObject()) {
            throw new StepInputException("Extract step requires input data to contain valid objects");
        }
        requireObjects((ArrayNode) input, "Extract");
    }

    @Override
    public JsonNode process(JsonNode input, Instant now) {
        ArrayNode records = (ArrayNode) input;
        JsonNode first = records.get(0);
        List<String> expectedKeys = fieldNames(first);

        boolean consistent = true;
        for (int i = 1; i < records.size(); i++) {
            List<String> keys = fieldNames(records.get(i));
            if (keys.size() != expectedKeys.size() || !keys.containsAll(expectedKeys)) {
                log.warn("Extract step: inconsistent record structure at index {}", i);
                consistent = false;
            }
        }

        ObjectNode dataTypes = nodes.objectNode();
        for (String key : expectedKeys) {
            dataTypes.put(key, typeName(first.get(key)));
        }

        ObjectNode validation = nodes.objectNode();
        validation.put("hasConsistentStructure", consistent);
        validation.put("totalRecords", records.size());
        validation.put("validRecords", records.size());

        ObjectNode metadata = nodes.objectNode();
        metadata.put("extractedAt", now.toString());
        metadata.put("recordCount", records.size());
        metadata.set("dataTypes", dataTypes);
        metadata.put("stepId", StepType.EXTRACT.stepId());
        metadata.set("validation", validation);

        ObjectNode output = nodes.objectNode();
        output.put("extractedRecords", records.size());
        output.set("data", records.deepCopy());
        output.set("metadata", metadata);
        return output;
    }

    private static List<String> fieldNames(JsonNode record) {
        List<String> names = new ArrayList<>();
        record.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
