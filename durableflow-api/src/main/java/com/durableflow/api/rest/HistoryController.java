package com.durableflow.api.rest;

import com.durableflow.core.model.Event;
import com.durableflow.core.model.WorkflowRunState;
import com.durableflow.engine.history.ExecutionHistoryService;
import com.durableflow.engine.history.ExecutionHistoryService.RunHistory;
import com.durableflow.engine.service.WorkflowService;
import com.durableflow.engine.service.WorkflowService.WorkflowStatusView;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * REST API for run inspection, execution history and replay.
 */
@RestController
@RequestMapping("/api/v1/runs/{runId}")
public class HistoryController {

    private final WorkflowService workflowService;
    private final ExecutionHistoryService historyService;

    public HistoryController(WorkflowService workflowService, ExecutionHistoryService historyService) {
        this.workflowService = workflowService;
        this.historyService = historyService;
    }

    @GetMapping
    public ResponseEntity<WorkflowStatusView> describe(@PathVariable String runId) {
        return ResponseEntity.ok(workflowService.describe(runId));
    }

    /**
     * Full execution history with per-activity breakdown.
     */
    @GetMapping("/history")
    public ResponseEntity<RunHistory> getHistory(@PathVariable String runId) {
        return ResponseEntity.ok(historyService.getHistory(runId));
    }

    /**
     * Events with sequence numbers in [from, to].
     */
    @GetMapping("/history/range")
    public ResponseEntity<List<Event>> getEventRange(
            @PathVariable String runId,
            @RequestParam long from,
            @RequestParam long to) {
        return ResponseEntity.ok(historyService.getEventRange(runId, from, to));
    }

    /**
     * Replay state to a specific sequence number or point in time.
     */
    @GetMapping("/history/replay")
    public ResponseEntity<WorkflowRunState> replay(
            @PathVariable String runId,
            @RequestParam(required = false) Long sequence,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant timestamp) {

        WorkflowRunState state;
        if (sequence != null) {
            state = historyService.replayToSequence(runId, sequence);
        } else if (timestamp != null) {
            state = historyService.replayToTimestamp(runId, timestamp);
        } else {
            throw new IllegalArgumentException("Either sequence or timestamp must be provided");
        }
        return ResponseEntity.ok(state);
    }
}
