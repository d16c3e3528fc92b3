package com.livepipe.realtime.repository;

import com.livepipe.realtime.model.Dataset;
import com.livepipe.realtime.model.ExecutionStatus;
import com.livepipe.realtime.model.PipelineConfig;
import com.livepipe.realtime.model.PipelineExecution;
import com.livepipe.realtime.pipeline.DatasetValidator;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRepositoriesTest {

    InMemoryDatasetCatalog             catalog = new InMemoryDatasetCatalog();
    InMemoryExecutionHistoryRepository history = new InMemoryExecutionHistoryRepository();

    @Test
    void catalog_seedsSampleDatasetsInOrder() {
        assertThat(catalog.findAll()).extracting(Dataset::id)
                .containsExactly("sales-data", "user-analytics", "users-dataset", "logs-dataset");
        assertThat(catalog.findAll()).allSatisfy(d -> {
            assertThat(d.recordCount()).isEqualTo(3);
            assertThat(DatasetValidator.validate(d)).isEmpty();
        });
    }

    @Test
    void catalog_unknownOrNullId_empty() {
        assertThat(catalog.findById("missing")).isEmpty();
        assertThat(catalog.findById(null)).isEmpty();
    }

    @Test
    void history_keepsEveryRecordAndFindsLatestById() {
        PipelineExecution first  = execution("exec-1");
        PipelineExecution second = execution("exec-2");
        first.markFailed("boom", Instant.parse("2024-01-20T10:00:05Z"));
        PipelineExecution failedRecord = first.snapshot();
        first.markRunning();
        first.markCompleted(null, Instant.parse("2024-01-20T10:00:09Z"));
        PipelineExecution completedRecord = first.snapshot();

        history.append(failedRecord);
        history.append(second);
        history.append(completedRecord);

        assertThat(history.findAll()).containsExactly(failedRecord, second, completedRecord);
        assertThat(history.findLast()).containsSame(completedRecord);
        assertThat(history.findById("exec-1")).containsSame(completedRecord);
        assertThat(failedRecord.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(failedRecord.getErrorMessage()).isEqualTo("boom");
    }

    @Test
    void history_clear() {
        history.append(execution("exec-1"));

        history.clear();

        assertThat(history.findAll()).isEmpty();
        assertThat(history.findLast()).isEmpty();
    }

    private PipelineExecution execution(String id) {
        return new PipelineExecution(id, catalog.findById("sales-data").orElseThrow(),
                PipelineConfig.defaults(), Instant.parse("2024-01-20T10:00:00Z"));
    }
}
