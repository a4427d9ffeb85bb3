package com.workstream.engine.persistence;

import com.workstream.core.model.ExecutionEvent;
import com.workstream.core.model.ExecutionEventType;
import com.workstream.core.repository.ExecutionEventRepository;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ExecutionEventRepository.
 * For demonstration and testing purposes.
 */
@Repository
public class InMemoryExecutionEventRepository implements ExecutionEventRepository {

    private final Map<String, List<ExecutionEvent>> eventsByRun = new ConcurrentHashMap<>();

    @Override
    public void append(ExecutionEvent event) {
        eventsByRun.computeIfAbsent(event.runId(), k -> new CopyOnWriteArrayList<>()).add(event);
    }

    @Override
    public List<ExecutionEvent> findByRunId(String runId) {
        return eventsByRun.getOrDefault(runId, List.of()).stream()
            .sorted(Comparator.comparingLong(ExecutionEvent::sequenceNumber))
            .collect(Collectors.toList());
    }

    @Override
    public List<ExecutionEvent> findByRunIdAndNodeId(String runId, String nodeId) {
        return findByRunId(runId).stream()
            .filter(e -> nodeId.equals(e.nodeId()))
            .collect(Collectors.toList());
    }

    @Override
    public Map<ExecutionEventType, Long> countByType(String runId) {
        return eventsByRun.getOrDefault(runId, List.of()).stream()
            .collect(Collectors.groupingBy(ExecutionEvent::type, Collectors.counting()));
    }
}
