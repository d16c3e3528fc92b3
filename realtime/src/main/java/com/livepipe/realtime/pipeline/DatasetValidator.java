package com.livepipe.realtime.pipeline;

import com.livepipe.realtime.model.Dataset;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a dataset before an execution is created for it.
 *
 * The schema check compares the first record's field names with the schema
 * keys, as the sample data is expected to be uniform.
 */
public final class DatasetValidator {

    private DatasetValidator() {}

    /** @return every problem found, empty if the dataset is usable */
    public static List<String> validate(Dataset dataset) {
        List<String> errors = new ArrayList<>();
        if (dataset.id() == null || dataset.id().isBlank()) {
            errors.add("Dataset ID is required");
        }
        if (dataset.name() == null || dataset.name().isBlank()) {
            errors.add("Dataset name is required");
        }
        if (dataset.format() == null) {
            errors.add("Dataset format must be one of: json, csv, xml, text");
        }
        if (dataset.records().isEmpty()) {
            errors.add("Sample data cannot be empty");
            return errors;
        }
        if (dataset.records().stream().anyMatch(r -> r == null)) {
            errors.add("Sample data must only contain records");
            return errors;
        }

        if (!dataset.schema().isEmpty()) {
            Map<String, Object> first = dataset.records().get(0);
            Set<String> recordKeys = first.keySet();
            Set<String> schemaKeys = dataset.schema().keySet();

            List<String> missing = schemaKeys.stream().filter(k -> !recordKeys.contains(k)).toList();
            List<String> extra   = recordKeys.stream().filter(k -> !schemaKeys.contains(k)).toList();
            if (!missing.isEmpty()) {
                errors.add("Missing keys in sample data: " + String.join(", ", missing));
            }
            if (!extra.isEmpty()) {
                errors.add("Extra keys in sample data: " + String.join(", ", extra));
            }
        }
        return errors;
    }
}
