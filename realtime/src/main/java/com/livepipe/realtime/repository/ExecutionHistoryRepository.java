package com.livepipe.realtime.repository;

import com.livepipe.realtime.model.PipelineExecution;

import java.util.List;
import java.util.Optional;

/**
 * Records of terminal executions in the order they ended.
 *
 * Each record is a snapshot taken at the terminal transition. A run that
 * fails and is then recovered ends more than once and keeps one record per
 * ending. Lives for the lifetime of the process only.
 */
public interface ExecutionHistoryRepository {

    void append(PipelineExecution snapshot);

    List<PipelineExecution> findAll();

    /** The latest record of the given execution. */
    Optional<PipelineExecution> findById(String id);

    Optional<PipelineExecution> findLast();

    void clear();
}
