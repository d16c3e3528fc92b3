package com.livepipe.realtime.api.dto;

import com.livepipe.realtime.model.Dataset;

import java.util.List;
import java.util.Map;

public record DatasetResponse(
        String                    id,
        String                    name,
        String                    description,
        String                    format,
        long                      size,
        int                       recordCount,
        Map<String, String>       schema,
        List<Map<String, Object>> sampleData
) {
    public static DatasetResponse from(Dataset d) {
        return new DatasetResponse(
                d.id(),
                d.name(),
                d.description(),
                d.format().wireName(),
                d.sizeBytes(),
                d.recordCount(),
                d.schema(),
                d.records()
        );
    }
}
