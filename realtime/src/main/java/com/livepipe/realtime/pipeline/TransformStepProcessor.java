package com.livepipe.realtime.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.livepipe.realtime.model.StepType;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;

/**
 * Enriches every loaded record with an id, a processing timestamp, a content
 * hash and the transformation version.
 */
@Component
public class TransformStepProcessor extends AbstractStepProcessor {

    static final String VERSION = "1.0.0";

    private static final List<String> TRANSFORMATIONS = List.of("add_id", "add_timestamp", "add_hash", "add_version");
    private static final List<String> ADDED_FIELDS    = List.of("processedAt", "recordHash", "transformationVersion");

    @Override
    public StepType type() {
        return StepType.TRANSFORM;
    }

    @Override
    public void validateInput(JsonNode input) {
        ArrayNode data = requireDataArray(input, "Transform step requires valid loaded data with data array");
        requireMetadata(input, "loadedAt", "Transform step requires metadata from load step");
        if (data.isEmpty()) {
            throw new StepInputException("Transform step: No data to transform");
        }
        requireObjects(data, "Transform");
    }

    @Override
    public JsonNode process(JsonNode input, Instant now) {
        ArrayNode data = (ArrayNode) input.get("data");

        ArrayNode transformed = nodes.arrayNode();
        for (int i = 0; i < data.size(); i++) {
            ObjectNode record = ((ObjectNode) data.get(i)).deepCopy();
            if (!hasUsableId(record.get("id"))) {
                record.put("id", i + 1);
            }
            record.put("processedAt", now.toString());
            record.put("recordHash", hash(data.get(i)));
            record.put("transformationVersion", VERSION);
            transformed.add(record);
        }
        if (transformed.size() != data.size()) {
            throw new StepException("Transform step: Output count mismatch. Expected "
                    + data.size() + ", got " + transformed.size());
        }

        ArrayNode outputSchema = nodes.arrayNode();
        transformed.get(0).fieldNames().forEachRemaining(outputSchema::add);

        ObjectNode transformValidation = nodes.objectNode();
        transformValidation.put("inputRecords", data.size());
        transformValidation.put("outputRecords", transformed.size());
        transformValidation.put("transformationSuccess", true);
        ADDED_FIELDS.forEach(transformValidation.putArray("addedFields")::add);

        ObjectNode metadata = ((ObjectNode) input.get("metadata")).deepCopy();
        metadata.put("transformedAt", now.toString());
        TRANSFORMATIONS.forEach(metadata.putArray("transformations")::add);
        metadata.set("outputSchema", outputSchema);
        metadata.put("stepId", StepType.TRANSFORM.stepId());
        metadata.set("transformValidation", transformValidation);

        ObjectNode output = nodes.objectNode();
        output.put("transformedRecords", transformed.size());
        output.set("data", transformed);
        output.set("metadata", metadata);
        return output;
    }

    // Falsy ids (missing, null, 0, "") are replaced by the 1-based position.
    private static boolean hasUsableId(JsonNode id) {
        if (id == null || id.isNull()) return false;
        if (id.isNumber())  return id.asDouble() != 0;
        if (id.isTextual()) return !id.asText().isEmpty();
        return true;
    }

    private static String hash(JsonNode record) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(record.toString().getBytes(StandardCharsets.UTF_8));
            return "hash_" + HexFormat.of().formatHex(bytes, 0, 5);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
