package com.phillippitts.modelorchestrator.service.orchestration;

import com.phillippitts.modelorchestrator.config.properties.AllocatorProperties;
import com.phillippitts.modelorchestrator.config.properties.ConcurrencyProperties;
import com.phillippitts.modelorchestrator.domain.AllocationPriority;
import com.phillippitts.modelorchestrator.domain.ModelType;
import com.phillippitts.modelorchestrator.domain.ResourceConstraints;
import com.phillippitts.modelorchestrator.domain.ResourceMap;
import com.phillippitts.modelorchestrator.domain.Task;
import com.phillippitts.modelorchestrator.domain.TaskRequirements;
import com.phillippitts.modelorchestrator.exception.AllocationInfeasibleException;
import com.phillippitts.modelorchestrator.exception.InsufficientMemoryException;
import com.phillippitts.modelorchestrator.exception.ModelProcessingException;
import com.phillippitts.modelorchestrator.service.allocation.AllocationResult;
import com.phillippitts.modelorchestrator.service.allocation.ResourceAllocator;
import com.phillippitts.modelorchestrator.service.allocation.RouteOptions;
import com.phillippitts.modelorchestrator.service.analysis.ModelChain;
import com.phillippitts.modelorchestrator.service.analysis.TaskAnalyzer;
import com.phillippitts.modelorchestrator.service.degradation.DegradationController;
import com.phillippitts.modelorchestrator.service.metrics.OrchestrationMetrics;
import com.phillippitts.modelorchestrator.service.scoring.CapabilityScorer;
import com.phillippitts.modelorchestrator.service.sequential.ProcessingStep;
import com.phillippitts.modelorchestrator.service.sequential.SequentialOrchestrator;
import com.phillippitts.modelorchestrator.service.sequential.StepResult;
import com.phillippitts.modelorchestrator.util.LogSanitizer;
import com.phillippitts.modelorchestrator.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Entry point for task execution. Wires the orchestration components into one flow:
 *
 * <ol>
 *   <li>admit the task (bounded in-flight count)</li>
 *   <li>analyze it and suggest a planner/executor chain</li>
 *   <li>plan the pipeline, with a planning step on the suggested planner, and reserve resources for it</li>
 *   <li>run the pipeline on the sequential orchestrator</li>
 *   <li>feed each step's timing back into capability scoring, then release the reservation</li>
 * </ol>
 *
 * <p>A route asks for the memory of its largest planned model and an even share of the pool's
 * CPU and token throughput across {@code max-in-flight} tasks, so concurrent tasks can hold
 * reservations side by side.
 *
 * <p>Failures before the pipeline starts come back as an already-failed future. The reservation
 * and the admission permit are always released.
 */
@Service
public class ModelOrchestrationService {

    private static final Logger LOG = LogManager.getLogger(ModelOrchestrationService.class);

    static final String MDC_TASK_ID = "taskId";

    /** Context tokens per requested token/second of throughput. */
    static final double CONTEXT_TOKENS_DIVISOR = 8.0;

    private static final int INPUT_PREVIEW_CHARS = 64;

    private static final long BYTES_PER_MB = 1024L * 1024;

    private final TaskAnalyzer analyzer;
    private final CapabilityScorer scorer;
    private final ResourceAllocator allocator;
    private final DegradationController degradation;
    private final SequentialOrchestrator sequential;
    private final OrchestrationMetrics metrics;
    private final AllocatorProperties allocatorProps;
    private final AdmissionGuard admissionGuard;
    private final int maxInFlight;
    private final Executor eventExecutor;

    public ModelOrchestrationService(TaskAnalyzer analyzer,
                                     CapabilityScorer scorer,
                                     ResourceAllocator allocator,
                                     DegradationController degradation,
                                     SequentialOrchestrator sequential,
                                     OrchestrationMetrics metrics,
                                     AllocatorProperties allocatorProps,
                                     ConcurrencyProperties concurrencyProps,
                                     @Qualifier("eventExecutor") Executor eventExecutor) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.degradation = Objects.requireNonNull(degradation, "degradation");
        this.sequential = Objects.requireNonNull(sequential, "sequential");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.allocatorProps = Objects.requireNonNull(allocatorProps, "allocatorProps");
        this.admissionGuard = new AdmissionGuard(concurrencyProps.getMaxInFlight(), concurrencyProps.getAcquireTimeoutMs());
        this.maxInFlight = concurrencyProps.getMaxInFlight();
        this.eventExecutor = Objects.requireNonNull(eventExecutor, "eventExecutor");
    }

    /**
     * Submits a task for execution.
     *
     * @param task task to run
     * @return future with the outcome; fails with the orchestrator exception that stopped the task
     */
    public CompletableFuture<TaskOutcome> submit(Task task) {
        Objects.requireNonNull(task, "task");
        ThreadContext.put(MDC_TASK_ID, task.id());
        try {
            return start(task);
        } finally {
            ThreadContext.remove(MDC_TASK_ID);
        }
    }

    /**
     * Current degradation, pool and model state.
     */
    public OrchestrationStatus status() {
        return new OrchestrationStatus(
                degradation.getCurrentDegradation(),
                degradation.getLastMemoryUsagePercent(),
                allocator.snapshot(),
                sequential.getLoadedModel().map(ModelType::id).orElse(null),
                sequential.getMemoryLimit(),
                sequential.getCurrentMemoryUsage(),
                admissionGuard.inFlight());
    }

    private CompletableFuture<TaskOutcome> start(Task task) {
        try {
            admissionGuard.acquire();
        } catch (RuntimeException ex) {
            LOG.warn("Task {} rejected at admission: {}", task.id(), ex.getMessage());
            metrics.incrementTaskFailure("none", ex.getClass().getSimpleName());
            return CompletableFuture.failedFuture(ex);
        }

        TaskRequirements requirements;
        ModelChain chain;
        List<ProcessingStep> plan;
        AllocationResult allocation;
        try {
            LOG.info("Task {} submitted: type={}, input={}", task.id(), task.type(),
                    LogSanitizer.truncate(task.input() == null ? null : String.valueOf(task.input()), INPUT_PREVIEW_CHARS));
            requirements = analyzer.analyze(task);
            chain = analyzer.suggestModelChain(requirements);
            plan = sequential.planTask(task, chain.planner());
            checkMemoryCeiling(task, plan);
            allocation = reserve(buildRoute(requirements, chain, plan));
        } catch (RuntimeException ex) {
            admissionGuard.release();
            metrics.incrementTaskFailure("none", ex.getClass().getSimpleName());
            return CompletableFuture.failedFuture(ex);
        }

        long startNanos = System.nanoTime();
        String executorId = chain.executor().id();
        return sequential.executePlan(task, plan).handleAsync(
                (phases, error) -> complete(task, plan, allocation, executorId, startNanos, phases, error),
                eventExecutor);
    }

    private TaskOutcome complete(Task task, List<ProcessingStep> plan, AllocationResult allocation, String executorId,
                                 long startNanos, List<StepResult> phases, Throwable error) {
        try {
            long elapsedNanos = System.nanoTime() - startNanos;
            metrics.recordTaskLatency(executorId, elapsedNanos);

            if (error != null) {
                Throwable cause = unwrap(error);
                recordStepFailure(plan, cause);
                metrics.incrementTaskFailure(executorId, cause.getClass().getSimpleName());
                LOG.warn("Task {} failed after {}ms: {}", task.id(), TimeUtils.nanosToMillis(elapsedNanos), cause.getMessage());
                throw new CompletionException(cause);
            }

            for (StepResult phase : phases) {
                scorer.recordSuccess(phase.modelId(), phase.capability(), phase.durationMs(),
                        phase.memoryMb() / allocatorProps.getMaxMemoryMb());
            }
            metrics.incrementTaskSuccess(executorId);
            return TaskOutcome.of(task.id(), executorId, phases, allocation.reservationId(),
                    allocation.priority(), TimeUtils.nanosToMillis(elapsedNanos));
        } finally {
            allocator.releaseResources(allocation);
            admissionGuard.release();
        }
    }

    private AllocationResult reserve(RouteOptions route) {
        AllocationPriority priority = AllocationPriority.fromConfidence(route.confidence());
        try {
            AllocationResult result = allocator.allocateResources(route);
            metrics.recordAllocation("granted", priority);
            return result;
        } catch (AllocationInfeasibleException ex) {
            metrics.recordAllocation(ex.getReason().name().toLowerCase(Locale.ROOT), priority);
            throw ex;
        }
    }

    /**
     * Only a failure timed inside a backend call counts against a model. Queue rejections and
     * steps refused before reaching the backend carry no duration and are not scored.
     */
    private void recordStepFailure(List<ProcessingStep> plan, Throwable cause) {
        if (!(cause instanceof ModelProcessingException failure) || failure.getDurationMs() == null) {
            return;
        }
        findFailedStep(plan, failure).ifPresent(step -> scorer.recordFailure(failure.getModelId(), step.capability(),
                failure.getDurationMs(), step.modelType().memoryRequirementMb() / allocatorProps.getMaxMemoryMb()));
    }

    /** The step whose operation failed, or for a load failure the first step on that model. */
    private static Optional<ProcessingStep> findFailedStep(List<ProcessingStep> plan, ModelProcessingException failure) {
        for (ProcessingStep step : plan) {
            if (step.operation().id().equals(failure.getOperation())) {
                return Optional.of(step);
            }
        }
        for (ProcessingStep step : plan) {
            if (step.modelType().id().equals(failure.getModelId())) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    /**
     * Rejects a plan whose largest model exceeds the memory ceiling the caller set on the task.
     * Tasks without explicit constraints are bounded by the pool alone.
     */
    private static void checkMemoryCeiling(Task task, List<ProcessingStep> plan) {
        ResourceConstraints requested = task.resourceConstraints();
        if (requested == null) {
            return;
        }
        for (ProcessingStep step : plan) {
            ModelType model = step.modelType();
            if (model.memoryRequirementMb() > requested.maxMemoryMb()) {
                LOG.warn("Task {} rejected: model {} needs {}MB, task allows {}MB",
                        task.id(), model.id(), Math.round(model.memoryRequirementMb()), Math.round(requested.maxMemoryMb()));
                throw new InsufficientMemoryException(model.id(), model.memoryRequirementBytes(),
                        (long) (requested.maxMemoryMb() * BYTES_PER_MB));
            }
        }
    }

    /**
     * Estimated cost:
     * <ul>
     *   <li>memory of the largest planned model, or the task's memory ceiling when the plan's
     *       models declare none</li>
     *   <li>CPU as an even share of the pool across {@code max-in-flight} tasks, capped by the
     *       task's CPU ceiling</li>
     *   <li>tokens/second from the context size, capped by an even share of the pool's throughput</li>
     * </ul>
     */
    RouteOptions buildRoute(TaskRequirements requirements, ModelChain chain, List<ProcessingStep> plan) {
        ResourceConstraints constraints = requirements.resourceConstraints();
        double memoryMb = plan.stream().mapToDouble(s -> s.modelType().memoryRequirementMb()).max().orElse(0);
        if (memoryMb <= 0) {
            memoryMb = constraints.maxMemoryMb();
        }
        double cpu = Math.min(constraints.maxCpu(), allocatorProps.getMaxCpu() / maxInFlight);
        double tokens = Math.min(requirements.contextSize() / CONTEXT_TOKENS_DIVISOR,
                allocatorProps.getMaxTokensPerSecond() / maxInFlight);
        double confidence = scorer.getCapabilityScore(chain.executor().id(), requirements.primaryCapability());
        return new RouteOptions(chain.executor().id(), new ResourceMap(memoryMb, cpu, tokens), confidence);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
