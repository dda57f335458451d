package com.phillippitts.modelorchestrator.service.orchestration;

import com.phillippitts.modelorchestrator.config.properties.AllocatorProperties;
import com.phillippitts.modelorchestrator.config.properties.ConcurrencyProperties;
import com.phillippitts.modelorchestrator.config.properties.DegradationProperties;
import com.phillippitts.modelorchestrator.config.properties.ScoringProperties;
import com.phillippitts.modelorchestrator.config.properties.SequentialProperties;
import com.phillippitts.modelorchestrator.domain.AllocationPriority;
import com.phillippitts.modelorchestrator.domain.DegradationLevel;
import com.phillippitts.modelorchestrator.domain.ModelCapability;
import com.phillippitts.modelorchestrator.domain.ModelType;
import com.phillippitts.modelorchestrator.domain.ResourceConstraints;
import com.phillippitts.modelorchestrator.domain.Task;
import com.phillippitts.modelorchestrator.domain.TaskRequirements;
import com.phillippitts.modelorchestrator.exception.AdmissionRejectedException;
import com.phillippitts.modelorchestrator.exception.AllocationInfeasibleException;
import com.phillippitts.modelorchestrator.exception.InsufficientMemoryException;
import com.phillippitts.modelorchestrator.exception.ModelProcessingException;
import com.phillippitts.modelorchestrator.exception.RequirementsValidationException;
import com.phillippitts.modelorchestrator.service.allocation.DefaultResourceAllocator;
import com.phillippitts.modelorchestrator.service.allocation.RouteOptions;
import com.phillippitts.modelorchestrator.service.analysis.DefaultTaskAnalyzer;
import com.phillippitts.modelorchestrator.service.analysis.ModelCatalog;
import com.phillippitts.modelorchestrator.service.analysis.ModelChain;
import com.phillippitts.modelorchestrator.service.degradation.DegradationController;
import com.phillippitts.modelorchestrator.service.metrics.OrchestrationMetrics;
import com.phillippitts.modelorchestrator.service.scoring.CapabilityScorer;
import com.phillippitts.modelorchestrator.service.sequential.ProcessingStep;
import com.phillippitts.modelorchestrator.service.sequential.SequentialOrchestrator;
import com.phillippitts.modelorchestrator.service.sequential.StepOperation;
import com.phillippitts.modelorchestrator.service.sequential.StepResult;
import com.phillippitts.modelorchestrator.testutil.EventCapturingPublisher;
import com.phillippitts.modelorchestrator.testutil.FakeMemoryProbe;
import com.phillippitts.modelorchestrator.testutil.MutableClock;
import com.phillippitts.modelorchestrator.testutil.RecordingModelBackend;
import com.phillippitts.modelorchestrator.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class ModelOrchestrationServiceTest {

    private static final long GIB = 1024L * 1024 * 1024;

    private static final ModelType TRANSCRIBER = new ModelType("transcriber", "Transcriber", 2 * GIB,
            EnumSet.of(ModelCapability.TRANSCRIPTION));
    private static final ModelType ANALYST = new ModelType("analyst", "Analyst", 4 * GIB,
            EnumSet.of(ModelCapability.ANALYSIS, ModelCapability.REASONING, ModelCapability.CODE));

    private FakeMemoryProbe probe;
    private DegradationController degradation;
    private DefaultResourceAllocator allocator;
    private CapabilityScorer scorer;
    private RecordingModelBackend backend;
    private SimpleMeterRegistry registry;
    private ModelCatalog catalog;
    private DefaultTaskAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.atEpoch();
        probe = new FakeMemoryProbe(50);
        degradation = new DegradationController(
                new DegradationProperties(), probe, new EventCapturingPublisher(), clock, null);
        allocator = new DefaultResourceAllocator(new AllocatorProperties(), degradation, clock);
        scorer = spy(new CapabilityScorer(new ScoringProperties(), clock));
        backend = new RecordingModelBackend();
        registry = new SimpleMeterRegistry();
        catalog = new ModelCatalog(List.of(TRANSCRIBER, ANALYST));
        analyzer = new DefaultTaskAnalyzer(catalog, scorer);
    }

    @Test
    void runsTaskEndToEnd() {
        ModelOrchestrationService service = service(new SyncExecutor(), new ConcurrencyProperties());

        TaskOutcome outcome = service.submit(Task.of("t-1", "transcription", "audio")).join();

        assertThat(outcome.taskId()).isEqualTo("t-1");
        assertThat(outcome.executorModel()).isEqualTo("transcriber");
        assertThat(outcome.steps()).containsExactly("plan@analyst", "transcribe@transcriber");
        assertThat(outcome.outputs()).containsExactly(
                "plan(audio)", "transcribe(PlannedInput[input=audio, plan=plan(audio)])");
        assertThat(outcome.result()).isEqualTo("transcribe(PlannedInput[input=audio, plan=plan(audio)])");
        assertThat(outcome.phases()).extracting(StepResult::operation).containsExactly("plan", "transcribe");
        assertThat(outcome.metrics().phaseCount()).isEqualTo(2);
        assertThat(outcome.metrics().totalMemoryMb()).isEqualTo(6144.0);
        assertThat(outcome.priority()).isEqualTo(AllocationPriority.LOW);
        assertThat(allocator.snapshot().activeReservations()).isZero();
        assertThat(degradation.getActiveResources()).isEmpty();
        assertThat(registry.get("orchestrator.task.success").tag("model", "transcriber").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("orchestrator.allocation").tag("outcome", "granted").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void successfulTasksBuildUpScores() {
        ModelOrchestrationService service = service(new SyncExecutor(), new ConcurrencyProperties());

        for (int i = 0; i < 5; i++) {
            service.submit(Task.of("t-" + i, "transcription", "audio")).join();
        }

        assertThat(scorer.getCapabilityScore("transcriber", ModelCapability.TRANSCRIPTION)).isPositive();
        assertThat(scorer.getCapabilityScore("analyst", ModelCapability.REASONING)).isPositive();
        assertThat(scorer.getModelScores("transcriber").performanceMetrics().resourceUsage())
                .isEqualTo(0.25);
    }

    @Test
    void scoresStepTimeNotQueueWait() throws InterruptedException {
        List<Runnable> queued = new ArrayList<>();
        ModelOrchestrationService service = service(queued::add, new ConcurrencyProperties());

        CompletableFuture<TaskOutcome> result = service.submit(Task.of("t-1", "transcription", "audio"));
        Thread.sleep(50);
        queued.forEach(Runnable::run);
        TaskOutcome outcome = result.join();

        StepResult transcribe = outcome.phases().get(1);
        assertThat(outcome.durationMs()).isGreaterThanOrEqualTo(50);
        assertThat(transcribe.durationMs()).isLessThan(50);
        verify(scorer).recordSuccess("transcriber", ModelCapability.TRANSCRIPTION, transcribe.durationMs(), 0.25);
    }

    @Test
    void backendFailureIsRecordedAndReleased() {
        backend.failOn("transcribe");
        ModelOrchestrationService service = service(new SyncExecutor(), new ConcurrencyProperties());

        CompletableFuture<TaskOutcome> result = service.submit(Task.of("t-1", "transcription", "audio"));
        Throwable failure = catchThrowable(result::join);

        assertThat(failure).isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ModelProcessingException.class);
        verify(scorer).recordFailure(eq("transcriber"), eq(ModelCapability.TRANSCRIPTION), anyDouble(), eq(0.25));
        verify(scorer, never()).recordFailure(eq("analyst"), any(), anyDouble(), anyDouble());
        assertThat(allocator.snapshot().activeReservations()).isZero();
        assertThat(service.status().inFlightTasks()).isZero();
        assertThat(registry.get("orchestrator.task.failure")
                .tag("model", "transcriber")
                .tag("reason", "ModelProcessingException")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void fullModelQueueFailsTaskWithoutPenalizingModels() {
        Executor full = command -> {
            throw new RejectedExecutionException("model queue full");
        };
        ModelOrchestrationService service = service(full, new ConcurrencyProperties());

        CompletableFuture<TaskOutcome> result = service.submit(Task.of("t-1", "transcription", "audio"));

        assertThat(catchThrowable(result::join)).hasCauseInstanceOf(RejectedExecutionException.class);
        verify(scorer, never()).recordFailure(anyString(), any(), anyDouble(), anyDouble());
        assertThat(allocator.snapshot().activeReservations()).isZero();
        assertThat(service.status().inFlightTasks()).isZero();
        assertThat(registry.get("orchestrator.task.failure")
                .tag("reason", "RejectedExecutionException")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void concurrentTasksHoldReservationsSideBySide() {
        List<Runnable> queued = new ArrayList<>();
        ModelOrchestrationService service = service(queued::add, new ConcurrencyProperties());

        CompletableFuture<TaskOutcome> first = service.submit(Task.of("t-1", "transcription", "audio"));
        CompletableFuture<TaskOutcome> second = service.submit(Task.of("t-2", "transcription", "audio"));

        assertThat(second).isNotCompletedExceptionally();
        assertThat(allocator.snapshot().activeReservations()).isEqualTo(2);
        assertThat(service.status().inFlightTasks()).isEqualTo(2);

        queued.forEach(Runnable::run);

        assertThat(first).succeedsWithin(Duration.ofSeconds(1));
        assertThat(second).succeedsWithin(Duration.ofSeconds(1));
        assertThat(allocator.snapshot().activeReservations()).isZero();
        assertThat(registry.get("orchestrator.allocation").tag("outcome", "granted").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void rejectsPlanOverCallerMemoryCeiling() {
        ModelOrchestrationService service = service(new SyncExecutor(), new ConcurrencyProperties());
        Task task = new Task("t-1", "transcription", "audio", null, new ResourceConstraints(500, 0.5, 1000));

        Throwable failure = catchThrowable(() -> service.submit(task).join());

        assertThat(failure).hasCauseInstanceOf(InsufficientMemoryException.class);
        assertThat(backend.calls()).isEmpty();
        assertThat(allocator.snapshot().activeReservations()).isZero();
        assertThat(service.status().inFlightTasks()).isZero();
    }

    @Test
    void degradationRefusalFailsTaskBeforeExecution() {
        probe.setUsedPercent(95);
        degradation.tick();
        ModelOrchestrationService service = service(new SyncExecutor(), new ConcurrencyProperties());

        Throwable failure = catchThrowable(() -> service.submit(Task.of("t-1", "transcription", "audio")).join());

        assertThat(failure).hasCauseInstanceOf(AllocationInfeasibleException.class);
        assertThat(backend.calls()).isEmpty();
        assertThat(service.status().inFlightTasks()).isZero();
        assertThat(registry.get("orchestrator.allocation").tag("outcome", "degradation").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void invalidConstraintsFailTaskBeforeReservation() {
        ModelOrchestrationService service = service(new SyncExecutor(), new ConcurrencyProperties());
        Task task = new Task("t-1", "analysis", "x", null, new ResourceConstraints(-1, 0.5, 100));

        Throwable failure = catchThrowable(() -> service.submit(task).join());

        assertThat(failure).hasCauseInstanceOf(RequirementsValidationException.class);
        assertThat(allocator.snapshot().activeReservations()).isZero();
        assertThat(service.status().inFlightTasks()).isZero();
    }

    @Test
    void rejectsTasksBeyondInFlightLimit() {
        List<Runnable> queued = new ArrayList<>();
        Executor deferred = queued::add;
        ConcurrencyProperties limits = new ConcurrencyProperties();
        limits.setMaxInFlight(1);
        limits.setAcquireTimeoutMs(20);
        ModelOrchestrationService service = service(deferred, limits);

        CompletableFuture<TaskOutcome> first = service.submit(Task.of("t-1", "transcription", "audio"));
        CompletableFuture<TaskOutcome> second = service.submit(Task.of("t-2", "transcription", "audio"));

        assertThat(second).failsWithin(Duration.ofSeconds(1));
        assertThat(catchThrowable(second::join)).hasCauseInstanceOf(AdmissionRejectedException.class);
        assertThat(service.status().inFlightTasks()).isEqualTo(1);

        queued.forEach(Runnable::run);

        assertThat(first).succeedsWithin(Duration.ofSeconds(1));
        assertThat(service.status().inFlightTasks()).isZero();
    }

    @Test
    void statusReflectsLoadedModel() {
        ModelOrchestrationService service = service(new SyncExecutor(), new ConcurrencyProperties());

        service.submit(Task.of("t-1", "analysis", "text")).join();
        OrchestrationStatus status = service.status();

        assertThat(status.degradationLevel()).isEqualTo(DegradationLevel.NONE);
        assertThat(status.loadedModel()).isEqualTo("analyst");
        assertThat(status.modelMemoryBytes()).isEqualTo(4 * GIB);
        assertThat(status.memoryLimitBytes()).isEqualTo(16 * GIB);
        assertThat(status.pool().activeReservations()).isZero();
    }

    @Test
    void clearsTaskIdFromLoggingContext() {
        ModelOrchestrationService service = service(new SyncExecutor(), new ConcurrencyProperties());

        service.submit(Task.of("t-1", "transcription", "audio")).join();

        assertThat(ThreadContext.get("taskId")).isNull();
    }

    @Test
    void routeCostComesFromLargestPlannedModel() {
        ModelOrchestrationService service = service(new SyncExecutor(), new ConcurrencyProperties());
        TaskRequirements requirements = analyzer.analyze(Task.of("t-1", "transcription", "audio"));
        ModelChain chain = analyzer.suggestModelChain(requirements);
        List<ProcessingStep> plan = List.of(
                new ProcessingStep(TRANSCRIBER, StepOperation.TRANSCRIBE, ModelCapability.TRANSCRIPTION),
                new ProcessingStep(ANALYST, StepOperation.ANALYZE, ModelCapability.ANALYSIS));

        RouteOptions route = service.buildRoute(requirements, chain, plan);

        assertThat(route.executorModelId()).isEqualTo("transcriber");
        assertThat(route.estimatedCost().memoryMb()).isEqualTo(4096.0);
        assertThat(route.estimatedCost().cpu()).isEqualTo(0.125);
        assertThat(route.estimatedCost().tokensPerSecond()).isEqualTo(125.0);
        assertThat(route.confidence()).isZero();
    }

    @Test
    void routeCpuRespectsTaskCeiling() {
        ModelOrchestrationService service = service(new SyncExecutor(), new ConcurrencyProperties());
        Task task = new Task("t-1", "transcription", "audio", null, new ResourceConstraints(4096, 0.05, 1000));
        TaskRequirements requirements = analyzer.analyze(task);

        RouteOptions route = service.buildRoute(requirements, analyzer.suggestModelChain(requirements),
                List.of(new ProcessingStep(TRANSCRIBER, StepOperation.TRANSCRIBE, ModelCapability.TRANSCRIPTION)));

        assertThat(route.estimatedCost().cpu()).isEqualTo(0.05);
        assertThat(route.estimatedCost().memoryMb()).isEqualTo(2048.0);
    }

    @Test
    void routeFallsBackToTaskMemoryCeiling() {
        ModelOrchestrationService service = service(new SyncExecutor(), new ConcurrencyProperties());
        ModelType weightless = new ModelType("weightless", null, 0L, EnumSet.of(ModelCapability.ANALYSIS));
        TaskRequirements requirements = analyzer.analyze(Task.of("t-1", "analysis", "x"));

        RouteOptions route = service.buildRoute(requirements, analyzer.suggestModelChain(requirements),
                List.of(new ProcessingStep(weightless, StepOperation.ANALYZE, ModelCapability.ANALYSIS)));

        assertThat(route.estimatedCost().memoryMb()).isEqualTo(1000.0);
    }

    private ModelOrchestrationService service(Executor modelExecutor, ConcurrencyProperties concurrency) {
        SequentialOrchestrator sequential = new SequentialOrchestrator(
                new SequentialProperties(), catalog, scorer, analyzer, backend, modelExecutor);
        OrchestrationMetrics metrics = new OrchestrationMetrics(registry, allocator, degradation);
        return new ModelOrchestrationService(analyzer, scorer, allocator, degradation, sequential, metrics,
                new AllocatorProperties(), concurrency, new SyncExecutor());
    }
}
