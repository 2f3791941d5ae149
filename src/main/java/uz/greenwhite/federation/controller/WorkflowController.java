package uz.greenwhite.federation.controller;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uz.greenwhite.federation.workflow.WorkflowEngine;
import uz.greenwhite.federation.workflow.model.ExecutionEvent;
import uz.greenwhite.federation.workflow.model.FederatedWorkflow;
import uz.greenwhite.federation.workflow.model.WorkflowDefinition;
import uz.greenwhite.federation.workflow.model.WorkflowExecution;
import uz.greenwhite.federation.workflow.model.WorkflowUpdate;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/workflows")
@RequiredArgsConstructor
public class WorkflowController {

    private final WorkflowEngine workflowEngine;

    @PostMapping
    public ResponseEntity<FederatedWorkflow> createWorkflow(@RequestBody WorkflowDefinition definition) {
        FederatedWorkflow created = workflowEngine.createWorkflow(definition);
        return ResponseEntity
                .created(URI.create("/api/v1/workflows/" + created.getId()))
                .body(created);
    }

    @GetMapping
    public ResponseEntity<List<FederatedWorkflow>> listWorkflows(
            @RequestParam(value = "client_id", required = false) String clientId) {
        return ResponseEntity.ok(workflowEngine.listWorkflows(clientId));
    }

    @GetMapping("/{workflowId}")
    public ResponseEntity<FederatedWorkflow> getWorkflow(@PathVariable UUID workflowId) {
        return ResponseEntity.ok(workflowEngine.getWorkflow(workflowId));
    }

    @PutMapping("/{workflowId}")
    public ResponseEntity<FederatedWorkflow> updateWorkflow(@PathVariable UUID workflowId,
                                                            @RequestBody WorkflowUpdate update) {
        return ResponseEntity.ok(workflowEngine.updateWorkflow(workflowId, update));
    }

    @DeleteMapping("/{workflowId}")
    public ResponseEntity<Void> deleteWorkflow(@PathVariable UUID workflowId) {
        workflowEngine.deleteWorkflow(workflowId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Runs to completion before answering. The optional body is the workflow input.
     */
    @PostMapping("/{workflowId}/execute")
    public ResponseEntity<WorkflowExecution> executeWorkflow(@PathVariable UUID workflowId,
                                                             @RequestBody(required = false) JsonNode input) {
        return ResponseEntity.ok(workflowEngine.executeWorkflow(workflowId, input));
    }

    @PostMapping("/{workflowId}/cancel")
    public ResponseEntity<WorkflowExecution> cancelWorkflow(@PathVariable UUID workflowId) {
        return ResponseEntity.ok(workflowEngine.cancelWorkflow(workflowId));
    }

    @GetMapping("/{workflowId}/status")
    public ResponseEntity<Map<String, Object>> getStatus(@PathVariable UUID workflowId) {
        return ResponseEntity.ok(Map.of(
                "workflow_id", workflowId,
                "status", workflowEngine.getStatus(workflowId)));
    }

    @GetMapping("/{workflowId}/execution")
    public ResponseEntity<WorkflowExecution> getExecution(@PathVariable UUID workflowId) {
        return ResponseEntity.ok(workflowEngine.getExecution(workflowId));
    }

    @GetMapping("/{workflowId}/history")
    public ResponseEntity<List<ExecutionEvent>> getHistory(@PathVariable UUID workflowId) {
        return ResponseEntity.ok(workflowEngine.getExecutionHistory(workflowId));
    }
}
