package com.durableflow.api.rest;

import com.durableflow.api.config.EngineProperties;
import com.durableflow.core.exception.AlreadyExistsException;
import com.durableflow.core.exception.InvalidStateTransitionException;
import com.durableflow.core.exception.NotFoundException;
import com.durableflow.core.model.Event;
import com.durableflow.core.model.EventType;
import com.durableflow.core.model.RunRecord;
import com.durableflow.core.model.WorkflowIdReusePolicy;
import com.durableflow.core.model.WorkflowStatus;
import com.durableflow.engine.history.ExecutionHistoryService;
import com.durableflow.engine.service.WorkflowService;
import com.durableflow.engine.service.WorkflowService.StartWorkflowRequest;
import com.durableflow.engine.service.WorkflowService.WorkflowResult;
import com.durableflow.engine.service.WorkflowService.WorkflowStatusView;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {WorkflowController.class, HistoryController.class})
@Import(WorkflowControllerTest.Properties.class)
class WorkflowControllerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @EnableConfigurationProperties(EngineProperties.class)
    static class Properties {
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WorkflowService workflowService;

    @MockBean
    private ExecutionHistoryService historyService;

    private static WorkflowStatusView view(String workflowId, String runId, WorkflowStatus status) {
        return new WorkflowStatusView(workflowId, runId, "order-fulfillment", status, 3,
            1, 0, false, null, NOW, NOW, null);
    }

    @Nested
    @DisplayName("Start")
    class Start {

        @Test
        @DisplayName("A started run answers 201 with its ids")
        void testStartWorkflow() throws Exception {
            when(workflowService.startWorkflow(any())).thenReturn("run-1");
            when(workflowService.describe("run-1")).thenReturn(view("order-42", "run-1", WorkflowStatus.RUNNING));

            mockMvc.perform(post("/api/v1/workflows/start")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("""
                        {"workflowType":"order-fulfillment","workflowId":"order-42",
                         "input":{"orderId":42},"idReusePolicy":"REJECT_DUPLICATE"}
                        """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.workflowId").value("order-42"))
                .andExpect(jsonPath("$.runId").value("run-1"));

            ArgumentCaptor<StartWorkflowRequest> captor = ArgumentCaptor.forClass(StartWorkflowRequest.class);
            verify(workflowService).startWorkflow(captor.capture());
            StartWorkflowRequest request = captor.getValue();
            assertThat(request.workflowType()).isEqualTo("order-fulfillment");
            assertThat(request.workflowId()).isEqualTo("order-42");
            assertThat(request.input().get("orderId").asInt()).isEqualTo(42);
            assertThat(request.idReusePolicy()).isEqualTo(WorkflowIdReusePolicy.REJECT_DUPLICATE);
        }

        @Test
        @DisplayName("A rejected duplicate answers 409")
        void testStartDuplicate() throws Exception {
            when(workflowService.startWorkflow(any())).thenThrow(new AlreadyExistsException("order-42", "run-1"));

            mockMvc.perform(post("/api/v1/workflows/start")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"workflowType\":\"order-fulfillment\",\"workflowId\":\"order-42\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value(AlreadyExistsException.ERROR_CODE));
        }

        @Test
        @DisplayName("An unknown workflow type answers 404")
        void testStartUnknownType() throws Exception {
            when(workflowService.startWorkflow(any())).thenThrow(new NotFoundException("Workflow type", "nope"));

            mockMvc.perform(post("/api/v1/workflows/start")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"workflowType\":\"nope\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value(NotFoundException.ERROR_CODE));
        }

        @Test
        @DisplayName("A missing workflow type answers 400")
        void testStartWithoutType() throws Exception {
            mockMvc.perform(post("/api/v1/workflows/start")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"workflowId\":\"order-42\"}"))
                .andExpect(status().isBadRequest());

            verify(workflowService, never()).startWorkflow(any());
        }
    }

    @Nested
    @DisplayName("Status and result")
    class StatusAndResult {

        @Test
        @DisplayName("Status reports the current run")
        void testGetStatus() throws Exception {
            when(workflowService.getStatus("order-42")).thenReturn(view("order-42", "run-1", WorkflowStatus.RUNNING));

            mockMvc.perform(get("/api/v1/workflows/order-42/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("run-1"))
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.pendingActivities").value(1));
        }

        @Test
        @DisplayName("A closed run's result answers 200 with its output")
        void testGetResultCompleted() throws Exception {
            when(workflowService.getResult(eq("order-42"), any())).thenReturn(new WorkflowResult(
                "order-42", "run-1", WorkflowStatus.COMPLETED, JsonNodeFactory.instance.textNode("shipped"), null));

            mockMvc.perform(get("/api/v1/workflows/order-42/result").param("waitSeconds", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.output").value("shipped"));

            verify(workflowService).getResult("order-42", Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("An open run's result answers 202 and the wait is capped")
        void testGetResultStillRunning() throws Exception {
            when(workflowService.getResult(eq("order-42"), any())).thenReturn(new WorkflowResult(
                "order-42", "run-1", WorkflowStatus.RUNNING, null, null));

            mockMvc.perform(get("/api/v1/workflows/order-42/result").param("waitSeconds", "3600"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("RUNNING"));

            verify(workflowService).getResult("order-42", Duration.ofSeconds(60));
        }
    }

    @Nested
    @DisplayName("Control")
    class Control {

        @Test
        @DisplayName("Cancel is accepted with the given reason")
        void testCancel() throws Exception {
            mockMvc.perform(post("/api/v1/workflows/order-42/cancel")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"reason\":\"customer request\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.accepted").value(true));

            verify(workflowService).requestCancellation("order-42", "customer request");
        }

        @Test
        @DisplayName("Terminating a closed run answers 409")
        void testTerminateClosedRun() throws Exception {
            doThrow(new InvalidStateTransitionException("run-1", WorkflowStatus.COMPLETED, "terminate"))
                .when(workflowService).terminate(eq("order-42"), anyString());

            mockMvc.perform(post("/api/v1/workflows/order-42/terminate"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value(InvalidStateTransitionException.ERROR_CODE));
        }

        @Test
        @DisplayName("Runs are listed newest first")
        void testListRuns() throws Exception {
            when(workflowService.listRuns("order-42")).thenReturn(List.of(
                RunRecord.open("order-42", "run-2", "order-fulfillment", "default", NOW.plusSeconds(60)),
                RunRecord.open("order-42", "run-1", "order-fulfillment", "default", NOW)
                    .withClosed(WorkflowStatus.FAILED, NOW.plusSeconds(30))));

            mockMvc.perform(get("/api/v1/workflows/order-42/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].runId").value("run-2"))
                .andExpect(jsonPath("$[1].closeStatus").value("FAILED"));
        }
    }

    @Nested
    @DisplayName("History")
    class History {

        @Test
        @DisplayName("A range returns the events between both bounds")
        void testEventRange() throws Exception {
            Event started = Event.create("run-1", EventType.WORKFLOW_STARTED, NOW,
                JsonNodeFactory.instance.objectNode(), Event.ACTOR_USER, "api").withSequenceNumber(1);
            when(historyService.getEventRange("run-1", 1, 1)).thenReturn(List.of(started));

            mockMvc.perform(get("/api/v1/runs/run-1/history/range").param("from", "1").param("to", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].type").value("WORKFLOW_STARTED"))
                .andExpect(jsonPath("$[0].sequenceNumber").value(1));
        }

        @Test
        @DisplayName("Replay without a target answers 400")
        void testReplayWithoutTarget() throws Exception {
            mockMvc.perform(get("/api/v1/runs/run-1/history/replay"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
        }

        @Test
        @DisplayName("Describing an unknown run answers 404")
        void testDescribeUnknownRun() throws Exception {
            when(workflowService.describe("missing")).thenThrow(new NotFoundException("Run", "missing"));

            mockMvc.perform(get("/api/v1/runs/missing"))
                .andExpect(status().isNotFound());
        }
    }
}
