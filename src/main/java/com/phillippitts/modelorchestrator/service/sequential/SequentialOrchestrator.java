package com.phillippitts.modelorchestrator.service.sequential;

import com.phillippitts.modelorchestrator.config.properties.SequentialProperties;
import com.phillippitts.modelorchestrator.domain.ModelCapability;
import com.phillippitts.modelorchestrator.domain.ModelType;
import com.phillippitts.modelorchestrator.domain.Task;
import com.phillippitts.modelorchestrator.exception.InsufficientMemoryException;
import com.phillippitts.modelorchestrator.exception.ModelProcessingException;
import com.phillippitts.modelorchestrator.exception.ModelProcessingExceptionBuilder;
import com.phillippitts.modelorchestrator.service.analysis.ModelCatalog;
import com.phillippitts.modelorchestrator.service.analysis.TaskAnalyzer;
import com.phillippitts.modelorchestrator.service.scoring.CapabilityScorer;
import com.phillippitts.modelorchestrator.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs task pipelines under a hard memory ceiling with at most one model loaded at a time.
 *
 * <p>Admission: a model is admitted only if its memory requirement is within the limit. The check
 * happens before anything is queued, so a rejected load leaves the loaded model and memory
 * accounting untouched.
 *
 * <p>Serialization: loads, unloads and pipeline steps all run on the single-worker
 * {@code modelExecutor}. A handoff unloads the current model before loading the next, so two
 * models are never active together.
 *
 * <p>Pipelines: known task types map to fixed step templates; anything else runs a single
 * {@link StepOperation#PROCESS} step for the task's primary capability. Each step's output is the
 * next step's input. When a planner is given, a {@link StepOperation#PLAN} step runs first on the
 * task input and the step after it receives a {@link PlannedInput}.
 *
 * <p>A full model queue is reported through the returned future, never thrown.
 */
@Service
public class SequentialOrchestrator {

    private static final Logger LOG = LogManager.getLogger(SequentialOrchestrator.class);

    private static final Map<String, List<StepOperation>> PIPELINES = Map.of(
            "transcription", List.of(StepOperation.TRANSCRIBE),
            "synthesis", List.of(StepOperation.SYNTHESIZE),
            "analysis", List.of(StepOperation.ANALYZE),
            "transcribe_and_analyze", List.of(StepOperation.TRANSCRIBE, StepOperation.ANALYZE),
            "revoice", List.of(StepOperation.TRANSCRIBE, StepOperation.SYNTHESIZE)
    );

    private final SequentialProperties props;
    private final ModelCatalog catalog;
    private final CapabilityScorer scorer;
    private final TaskAnalyzer analyzer;
    private final ModelBackend backend;
    private final Executor modelExecutor;

    // Written only on the model worker
    private volatile ModelType loadedModel;

    public SequentialOrchestrator(SequentialProperties props,
                                  ModelCatalog catalog,
                                  CapabilityScorer scorer,
                                  TaskAnalyzer analyzer,
                                  ModelBackend backend,
                                  @Qualifier("modelExecutor") Executor modelExecutor) {
        this.props = Objects.requireNonNull(props, "props");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.modelExecutor = Objects.requireNonNull(modelExecutor, "modelExecutor");
    }

    /**
     * Loads a model, unloading the current one first if it is different.
     *
     * @param model model to load
     * @return future completing when the model is loaded; fails with
     *         {@link InsufficientMemoryException} if the model exceeds the memory limit, or with
     *         {@link ModelProcessingException} if the backend fails
     */
    public CompletableFuture<Void> loadModel(ModelType model) {
        Objects.requireNonNull(model, "model");
        try {
            checkAdmission(model);
        } catch (InsufficientMemoryException ex) {
            LOG.warn("Load of {} rejected: {}", model.id(), ex.getMessage());
            return CompletableFuture.failedFuture(ex);
        }
        return submitToWorker("load " + model.id(), () -> {
            switchTo(model);
            return null;
        });
    }

    /**
     * Unloads the active model, if any.
     */
    public CompletableFuture<Void> unloadModel() {
        return submitToWorker("unload", () -> {
            unloadCurrent();
            return null;
        });
    }

    /**
     * Plans and runs a task's pipeline.
     *
     * @param task task to run
     * @return future with one output per step, in order
     */
    public CompletableFuture<List<Object>> processTask(Task task) {
        Objects.requireNonNull(task, "task");
        List<ProcessingStep> plan;
        try {
            plan = planTask(task);
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        return executePlan(task, plan).thenApply(results -> results.stream().map(StepResult::output).toList());
    }

    /**
     * Runs an already-planned pipeline on the model worker.
     *
     * @param task task whose input feeds the first step
     * @param plan steps from {@link #planTask(Task)} or {@link #planTask(Task, ModelType)}
     * @return future with one result per step, in order; fails with
     *         {@link RejectedExecutionException} if the model queue is full
     */
    public CompletableFuture<List<StepResult>> executePlan(Task task, List<ProcessingStep> plan) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(plan, "plan");
        return submitToWorker("task " + task.id(), () -> runPipeline(task, plan));
    }

    /**
     * Builds the step list for a task with a planning step on {@code planner} ahead of it.
     * The planning step is left out when planning is disabled, when the planner is not a
     * catalog model, or when it exceeds the memory limit.
     *
     * @param task    task to plan
     * @param planner planner suggested for the task
     */
    public List<ProcessingStep> planTask(Task task, ModelType planner) {
        Objects.requireNonNull(planner, "planner");
        List<ProcessingStep> pipeline = planTask(task);
        Optional<ProcessingStep> planning = planningStep(task, planner);
        if (planning.isEmpty()) {
            return pipeline;
        }
        List<ProcessingStep> steps = new ArrayList<>(pipeline.size() + 1);
        steps.add(planning.get());
        steps.addAll(pipeline);
        return Collections.unmodifiableList(steps);
    }

    /**
     * Builds the ordered step list for a task. Every step's model fits the memory limit.
     *
     * @throws InsufficientMemoryException if a step's capability is only offered by models over the limit
     * @throws ModelProcessingException if no catalog model offers a step's capability
     */
    public List<ProcessingStep> planTask(Task task) {
        List<StepOperation> operations = PIPELINES.get(task.type());
        List<ProcessingStep> steps = new ArrayList<>();
        if (operations == null) {
            ModelCapability primary = analyzer.analyze(task).primaryCapability();
            steps.add(new ProcessingStep(selectModel(primary), StepOperation.PROCESS, primary));
        } else {
            for (StepOperation operation : operations) {
                steps.add(new ProcessingStep(selectModel(operation.capability()), operation, operation.capability()));
            }
        }
        LOG.debug("Planned task {} ({}): {}", task.id(), task.type(),
                steps.stream().map(s -> s.operation().id() + "@" + s.modelType().id()).toList());
        return Collections.unmodifiableList(steps);
    }

    public long getMemoryLimit() {
        return props.getMemoryLimitBytes();
    }

    /** Memory held by the loaded model, in bytes; 0 when nothing is loaded. */
    public long getCurrentMemoryUsage() {
        ModelType current = loadedModel;
        return current == null ? 0L : current.memoryRequirementBytes();
    }

    public Optional<ModelType> getLoadedModel() {
        return Optional.ofNullable(loadedModel);
    }

    private void checkAdmission(ModelType model) {
        if (model.memoryRequirementBytes() > props.getMemoryLimitBytes()) {
            throw new InsufficientMemoryException(model.id(), model.memoryRequirementBytes(), props.getMemoryLimitBytes());
        }
    }

    private Optional<ProcessingStep> planningStep(Task task, ModelType planner) {
        if (!props.isPlanning()) {
            return Optional.empty();
        }
        Optional<ModelType> model = catalog.find(planner.id());
        if (model.isEmpty()) {
            LOG.debug("Task {}: planner {} is not a catalog model, skipping planning", task.id(), planner.id());
            return Optional.empty();
        }
        if (model.get().memoryRequirementBytes() > props.getMemoryLimitBytes()) {
            LOG.info("Task {}: planner {} exceeds the memory limit, skipping planning", task.id(), planner.id());
            return Optional.empty();
        }
        return Optional.of(new ProcessingStep(model.get(), StepOperation.PLAN, StepOperation.PLAN.capability()));
    }

    private <T> CompletableFuture<T> submitToWorker(String description, Supplier<T> work) {
        try {
            return CompletableFuture.supplyAsync(work, modelExecutor);
        } catch (RejectedExecutionException ex) {
            LOG.warn("Model queue rejected {}: {}", description, ex.getMessage());
            return CompletableFuture.failedFuture(ex);
        }
    }

    private List<StepResult> runPipeline(Task task, List<ProcessingStep> plan) {
        long start = System.nanoTime();
        List<StepResult> results = new ArrayList<>(plan.size());
        Object carried = task.input();
        Object pendingPlan = null;
        for (ProcessingStep step : plan) {
            ModelType model = modelFor(step);
            if (step.operation() == StepOperation.PLAN) {
                StepResult planned = runStep(model, step, task.input());
                results.add(planned);
                pendingPlan = planned.output();
                continue;
            }
            Object input = pendingPlan != null ? new PlannedInput(carried, pendingPlan) : carried;
            pendingPlan = null;
            StepResult result = runStep(model, step, input);
            results.add(result);
            carried = result.output();
        }
        LOG.info("Task {} completed {} step(s) in {}ms", task.id(), plan.size(), TimeUtils.elapsedMillis(start));
        return results;
    }

    private ModelType modelFor(ProcessingStep step) {
        ModelType current = loadedModel;
        if (current != null && current.hasCapability(step.capability())) {
            return current;
        }
        if (!props.isAutoLoad()) {
            throw ModelProcessingExceptionBuilder.create("No loaded model supports step")
                    .model(current == null ? "none" : current.id())
                    .operation(step.operation().id())
                    .metadata("capability", step.capability().id())
                    .build();
        }
        checkAdmission(step.modelType());
        switchTo(step.modelType());
        return step.modelType();
    }

    private StepResult runStep(ModelType model, ProcessingStep step, Object input) {
        long start = System.nanoTime();
        Object output;
        try {
            output = backend.process(model, step, input);
        } catch (ModelProcessingException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            LOG.error("Step {} failed on model {}", step.operation().id(), model.id(), ex);
            throw ModelProcessingExceptionBuilder.create("Model step failed")
                    .model(model.id())
                    .operation(step.operation().id())
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .cause(ex)
                    .build();
        }
        return new StepResult(step.operation().id(), model.id(), step.capability(), output,
                TimeUtils.elapsedMillis(start), model.memoryRequirementMb());
    }

    /** Runs on the model worker. */
    private void switchTo(ModelType model) {
        ModelType current = loadedModel;
        if (current != null && current.id().equals(model.id())) {
            LOG.debug("Model {} already loaded", model.id());
            return;
        }
        if (current != null) {
            LOG.info("Handoff {} -> {}", current.id(), model.id());
            unloadCurrent();
        }
        long start = System.nanoTime();
        try {
            backend.load(model);
        } catch (RuntimeException ex) {
            LOG.error("Failed to load model {}", model.id(), ex);
            throw ModelProcessingExceptionBuilder.create("Model load failed")
                    .model(model.id())
                    .operation("load")
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .cause(ex)
                    .build();
        }
        loadedModel = model;
        LOG.info("Loaded model {} ({} bytes of {} limit) in {}ms",
                model.id(), model.memoryRequirementBytes(), props.getMemoryLimitBytes(), TimeUtils.elapsedMillis(start));
    }

    /** Runs on the model worker. The slot is cleared even if the backend fails to unload. */
    private void unloadCurrent() {
        ModelType current = loadedModel;
        if (current == null) {
            return;
        }
        try {
            backend.unload(current);
        } catch (RuntimeException ex) {
            LOG.error("Failed to unload model {}", current.id(), ex);
            throw ModelProcessingExceptionBuilder.create("Model unload failed")
                    .model(current.id())
                    .operation("unload")
                    .cause(ex)
                    .build();
        } finally {
            loadedModel = null;
        }
        LOG.info("Unloaded model {}", current.id());
    }

    private ModelType selectModel(ModelCapability capability) {
        List<ModelType> capable = catalog.withCapability(capability);
        if (capable.isEmpty()) {
            throw ModelProcessingExceptionBuilder.create("No model offers capability")
                    .metadata("capability", capability.id())
                    .build();
        }
        ModelType current = loadedModel;
        ModelType best = null;
        double bestScore = -1;
        ModelType smallest = capable.get(0);
        for (ModelType candidate : capable) {
            if (candidate.memoryRequirementBytes() < smallest.memoryRequirementBytes()) {
                smallest = candidate;
            }
            if (candidate.memoryRequirementBytes() > props.getMemoryLimitBytes()) {
                continue;
            }
            double score = scorer.getCapabilityScore(candidate.id(), capability);
            boolean preferLoaded = score == bestScore && current != null && candidate.id().equals(current.id());
            if (score > bestScore || preferLoaded) {
                best = candidate;
                bestScore = score;
            }
        }
        if (best == null) {
            throw new InsufficientMemoryException(
                    smallest.id(), smallest.memoryRequirementBytes(), props.getMemoryLimitBytes());
        }
        return best;
    }
}
