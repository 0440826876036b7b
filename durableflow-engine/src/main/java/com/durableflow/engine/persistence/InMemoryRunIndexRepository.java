package com.durableflow.engine.persistence;

import com.durableflow.core.model.RunRecord;
import com.durableflow.core.model.WorkflowStatus;
import com.durableflow.core.repository.RunIndexRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of RunIndexRepository.
 * For demonstration and testing purposes.
 */
public class InMemoryRunIndexRepository implements RunIndexRepository {

    private final Map<String, RunRecord> byRunId = new LinkedHashMap<>();
    private final Map<String, List<String>> runsByWorkflow = new HashMap<>();

    @Override
    public synchronized Optional<RunRecord> register(RunRecord record, boolean rejectIfOpen) {
        if (rejectIfOpen) {
            Optional<RunRecord> open = runsOf(record.workflowId()).stream()
                .filter(RunRecord::isOpen)
                .findFirst();
            if (open.isPresent()) {
                return open;
            }
        }
        byRunId.put(record.runId(), record);
        runsByWorkflow.computeIfAbsent(record.workflowId(), k -> new ArrayList<>()).add(record.runId());
        return Optional.empty();
    }

    @Override
    public synchronized void markClosed(String runId, WorkflowStatus status, Instant closedAt) {
        RunRecord record = byRunId.get(runId);
        if (record != null && record.isOpen()) {
            byRunId.put(runId, record.withClosed(status, closedAt));
        }
    }

    @Override
    public synchronized Optional<RunRecord> findByRunId(String runId) {
        return Optional.ofNullable(byRunId.get(runId));
    }

    @Override
    public synchronized Optional<RunRecord> findCurrent(String workflowId) {
        List<RunRecord> runs = runsOf(workflowId);
        return runs.isEmpty() ? Optional.empty() : Optional.of(runs.get(0));
    }

    @Override
    public synchronized List<RunRecord> findByWorkflowId(String workflowId) {
        return runsOf(workflowId);
    }

    @Override
    public synchronized List<RunRecord> findOpen(int limit) {
        return byRunId.values().stream()
            .filter(RunRecord::isOpen)
            .sorted(Comparator.comparing(RunRecord::createdAt))
            .limit(limit)
            .toList();
    }

    @Override
    public synchronized int countOpen() {
        return (int) byRunId.values().stream().filter(RunRecord::isOpen).count();
    }

    // Newest first
    private List<RunRecord> runsOf(String workflowId) {
        List<RunRecord> runs = new ArrayList<>();
        for (String runId : runsByWorkflow.getOrDefault(workflowId, List.of())) {
            runs.add(byRunId.get(runId));
        }
        Collections.reverse(runs);
        return runs;
    }
}
