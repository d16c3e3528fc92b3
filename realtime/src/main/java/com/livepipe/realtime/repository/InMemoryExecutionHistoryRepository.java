package com.livepipe.realtime.repository;

import com.livepipe.realtime.model.PipelineExecution;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
public class InMemoryExecutionHistoryRepository implements ExecutionHistoryRepository {

    private final CopyOnWriteArrayList<PipelineExecution> store = new CopyOnWriteArrayList<>();

    @Override
    public void append(PipelineExecution snapshot) {
        store.add(snapshot);
    }

    @Override
    public List<PipelineExecution> findAll() {
        return List.copyOf(store);
    }

    @Override
    public Optional<PipelineExecution> findById(String id) {
        return store.stream().filter(e -> e.getId().equals(id)).reduce((first, second) -> second);
    }

    @Override
    public Optional<PipelineExecution> findLast() {
        List<PipelineExecution> snapshot = List.copyOf(store);
        return snapshot.isEmpty() ? Optional.empty() : Optional.of(snapshot.get(snapshot.size() - 1));
    }

    @Override
    public void clear() {
        store.clear();
    }
}
