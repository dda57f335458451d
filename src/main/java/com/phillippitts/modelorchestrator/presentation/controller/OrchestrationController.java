package com.phillippitts.modelorchestrator.presentation.controller;

import com.phillippitts.modelorchestrator.domain.ResourceConstraints;
import com.phillippitts.modelorchestrator.domain.Task;
import com.phillippitts.modelorchestrator.domain.TaskPriority;
import com.phillippitts.modelorchestrator.service.orchestration.ModelOrchestrationService;
import com.phillippitts.modelorchestrator.service.orchestration.OrchestrationStatus;
import com.phillippitts.modelorchestrator.service.orchestration.TaskOutcome;
import com.phillippitts.modelorchestrator.service.scoring.CapabilityScore;
import com.phillippitts.modelorchestrator.service.scoring.CapabilityScorer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP surface of the orchestrator.
 *
 * <ul>
 *   <li>{@code POST /api/tasks} - submit a task; completes when its pipeline finishes</li>
 *   <li>{@code GET /api/orchestration/status} - degradation, pool and model state</li>
 *   <li>{@code GET /api/models/{id}/scores} - capability scores for one model</li>
 * </ul>
 *
 * <p>Failures are mapped to status codes by {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
class OrchestrationController {

    private static final Logger LOG = LogManager.getLogger(OrchestrationController.class);

    private final ModelOrchestrationService orchestrationService;
    private final CapabilityScorer scorer;

    OrchestrationController(ModelOrchestrationService orchestrationService, CapabilityScorer scorer) {
        this.orchestrationService = orchestrationService;
        this.scorer = scorer;
    }

    @PostMapping("/tasks")
    CompletableFuture<ResponseEntity<TaskOutcome>> submit(@Valid @RequestBody TaskRequest request) {
        Task task = request.toTask();
        LOG.info("Task {} received via HTTP: type={}", task.id(), task.type());
        return orchestrationService.submit(task).thenApply(ResponseEntity::ok);
    }

    @GetMapping("/orchestration/status")
    ResponseEntity<OrchestrationStatus> status() {
        return ResponseEntity.ok(orchestrationService.status());
    }

    @GetMapping("/models/{id}/scores")
    ResponseEntity<CapabilityScore> scores(@PathVariable("id") String modelId) {
        return ResponseEntity.ok(scorer.getModelScores(modelId));
    }

    /**
     * Request body for {@code POST /api/tasks}. A missing id is generated.
     */
    record TaskRequest(
            String id,
            @NotBlank String type,
            Object input,
            TaskPriority priority,
            ResourceConstraints resourceConstraints
    ) {
        Task toTask() {
            String taskId = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
            return new Task(taskId, type, input, priority, resourceConstraints);
        }
    }
}
