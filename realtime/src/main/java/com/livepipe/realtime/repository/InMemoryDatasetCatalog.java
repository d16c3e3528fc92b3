package com.livepipe.realtime.repository;

import com.livepipe.realtime.model.Dataset;
import com.livepipe.realtime.model.DatasetFormat;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The static sample datasets shipped with the demo.
 */
@Repository
public class InMemoryDatasetCatalog implements DatasetCatalog {

    private final Map<String, Dataset> store = new LinkedHashMap<>();

    public InMemoryDatasetCatalog() {
        this(sampleDatasets());
    }

    public InMemoryDatasetCatalog(List<Dataset> datasets) {
        for (Dataset dataset : datasets) {
            store.put(dataset.id(), dataset);
        }
    }

    @Override
    public List<Dataset> findAll() {
        return new ArrayList<>(store.values());
    }

    @Override
    public Optional<Dataset> findById(String id) {
        return Optional.ofNullable(id).map(store::get);
    }

    // ------------------------------------------------------------------
    // Seed data
    // ------------------------------------------------------------------

    static List<Dataset> sampleDatasets() {
        return List.of(
                new Dataset("sales-data", "Sales Data Sample",
                        "Sample e-commerce sales data for transformation demonstration",
                        DatasetFormat.JSON, 1024,
                        List.of(
                                record("id", "S-1001", "product", "Laptop",   "quantity", 1, "price", 1299.99, "date", "2024-01-15", "customer", "Alice"),
                                record("id", "S-1002", "product", "Mouse",    "quantity", 3, "price", 29.99,   "date", "2024-01-16", "customer", "Bob"),
                                record("id", "S-1003", "product", "Keyboard", "quantity", 2, "price", 89.99,   "date", "2024-01-17", "customer", "Carol")),
                        schema("id", "string", "product", "string", "quantity", "number",
                                "price", "number", "date", "date", "customer", "string")),

                new Dataset("user-analytics", "User Analytics Data",
                        "Sample user behavior analytics data",
                        DatasetFormat.JSON, 2048,
                        List.of(
                                record("userId", "u-17", "sessionId", "s-901", "action", "page_view",   "timestamp", "2024-01-20T10:30:00Z", "metadata", Map.of("page", "/home")),
                                record("userId", "u-17", "sessionId", "s-901", "action", "add_to_cart", "timestamp", "2024-01-20T10:31:12Z", "metadata", Map.of("sku", "LAP-13")),
                                record("userId", "u-42", "sessionId", "s-902", "action", "checkout",    "timestamp", "2024-01-20T10:33:47Z", "metadata", Map.of("total", 129.5))),
                        schema("userId", "string", "sessionId", "string", "action", "string",
                                "timestamp", "date", "metadata", "object")),

                new Dataset("users-dataset", "User Profiles",
                        "Sample user profile data with demographics and preferences",
                        DatasetFormat.JSON, 1024,
                        List.of(
                                record("id", 1, "name", "Alice Johnson", "age", 28, "city", "Seattle",       "role", "developer"),
                                record("id", 2, "name", "Bob Smith",     "age", 34, "city", "Portland",      "role", "designer"),
                                record("id", 3, "name", "Carol Davis",   "age", 29, "city", "San Francisco", "role", "manager")),
                        schema("id", "number", "name", "string", "age", "number", "city", "string", "role", "string")),

                new Dataset("logs-dataset", "Application Logs",
                        "Server application logs with timestamps and error levels",
                        DatasetFormat.JSON, 512,
                        List.of(
                                record("timestamp", "2024-01-20T10:30:00Z", "level", "INFO",  "message", "Application started",        "service", "api"),
                                record("timestamp", "2024-01-20T10:31:15Z", "level", "WARN",  "message", "High memory usage detected", "service", "worker"),
                                record("timestamp", "2024-01-20T10:32:30Z", "level", "ERROR", "message", "Database connection failed", "service", "api")),
                        schema("timestamp", "string", "level", "string", "message", "string", "service", "string")));
    }

    private static Map<String, Object> record(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    private static Map<String, String> schema(String... keyValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
