package com.livepipe.realtime.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.livepipe.realtime.model.StepType;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Loads extracted records into the (simulated) warehouse in fixed-size batches.
 */
@Component
public class LoadStepProcessor extends AbstractStepProcessor {

    static final int BATCH_SIZE  = 500;
    static final int MAX_RECORDS = 10_000;

    @Override
    public StepType type() {
        return StepType.LOAD;
    }

    @Override
    public void validateInput(JsonNode input) {
        ArrayNode data = requireDataArray(input, "Load step requires valid extracted data with data array");
        ObjectNode metadata = requireMetadata(input, "recordCount", "Load step requires metadata from extract step");

        int expected = metadata.path("recordCount").asInt();
        if (expected <= 0) {
            throw new StepInputException("Load step requires metadata from extract step");
        }
        if (data.size() != expected) {
            throw new StepInputException("Load step: Data count mismatch. Expected "
                    + expected + ", got " + data.size());
        }
        if (data.size() > MAX_RECORDS) {
            throw new StepInputException("Load step: Dataset too large for processing (max 10,000 records)");
        }
    }

    @Override
    public JsonNode process(JsonNode input, Instant now) {
        ArrayNode data = (ArrayNode) input.get("data");
        int batches = (data.size() + BATCH_SIZE - 1) / BATCH_SIZE;

        ObjectNode loadValidation = nodes.objectNode();
        loadValidation.put("recordsProcessed", data.size());
        loadValidation.put("batchesProcessed", batches);
        loadValidation.put("loadTime", now.toString());

        ObjectNode metadata = ((ObjectNode) input.get("metadata")).deepCopy();
        metadata.put("loadedAt", now.toString());
        metadata.put("batchSize", Math.min(data.size(), BATCH_SIZE));
        metadata.put("batches", batches);
        metadata.put("stepId", StepType.LOAD.stepId());
        metadata.set("loadValidation", loadValidation);

        ObjectNode output = nodes.objectNode();
        output.put("loadedRecords", data.size());
        output.set("data", data.deepCopy());
        output.set("metadata", metadata);
        return output;
    }
}
