package com.livepipe.realtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A sample dataset the pipeline can run over.
 *
 * Records are flat field → value maps. The whole value is immutable, so an
 * execution can keep a reference as its input snapshot.
 *
 * @param schema field name → declared type ("string", "number", ...), in field order
 */
public record Dataset(
        String                    id,
        String                    name,
        String                    description,
        DatasetFormat             format,
        long                      sizeBytes,
        List<Map<String, Object>> records,
        Map<String, String>       schema
) {
    public Dataset {
        records = records == null ? List.of() : records.stream()
                .map(Dataset::freeze)
                .toList();
        schema = schema == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(schema));
    }

    public int recordCount() {
        return records.size();
    }

    // LinkedHashMap keeps field order for the step metadata; Map.copyOf would not.
    private static Map<String, Object> freeze(Map<String, Object> record) {
        return record == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(record));
    }
}
