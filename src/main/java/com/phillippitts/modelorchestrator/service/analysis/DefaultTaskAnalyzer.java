package com.phillippitts.modelorchestrator.service.analysis;

import com.phillippitts.modelorchestrator.domain.ModelCapability;
import com.phillippitts.modelorchestrator.domain.ModelType;
import com.phillippitts.modelorchestrator.domain.ResourceConstraints;
import com.phillippitts.modelorchestrator.domain.Task;
import com.phillippitts.modelorchestrator.domain.TaskPriority;
import com.phillippitts.modelorchestrator.domain.TaskRequirements;
import com.phillippitts.modelorchestrator.exception.RequirementsValidationException;
import com.phillippitts.modelorchestrator.service.scoring.CapabilityScorer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Deterministic task analyzer backed by a fixed task-type table.
 *
 * <table>
 *   <caption>Task type lookup</caption>
 *   <tr><th>type</th><th>primary</th><th>secondary</th><th>base context</th></tr>
 *   <tr><td>architecture</td><td>reasoning</td><td>analysis, code, reasoning</td><td>4096</td></tr>
 *   <tr><td>code_generation</td><td>code</td><td>analysis, reasoning</td><td>2048</td></tr>
 *   <tr><td>transcription</td><td>transcription</td><td>analysis</td><td>2048</td></tr>
 *   <tr><td>synthesis</td><td>synthesis</td><td>analysis</td><td>2048</td></tr>
 *   <tr><td>analysis</td><td>analysis</td><td>streaming, reasoning</td><td>2048</td></tr>
 *   <tr><td>anything else</td><td>reasoning</td><td>analysis, reasoning</td><td>2048</td></tr>
 * </table>
 *
 * <p>Inputs whose JSON form exceeds 1000 characters grow the context to {@code ceil(1.5 x length)}.
 */
@Service
public class DefaultTaskAnalyzer implements TaskAnalyzer {

    private static final Logger LOG = LogManager.getLogger(DefaultTaskAnalyzer.class);

    static final double PRIMARY_MIN_SCORE = 0.8;
    static final double SECONDARY_MIN_SCORE = 0.6;
    static final int LARGE_INPUT_CHARS = 1000;
    static final double INPUT_CONTEXT_FACTOR = 1.5;

    static final ModelType DEFAULT_PLANNER = new ModelType(
            "default-planner", "Default Planning Model", 0L, EnumSet.of(ModelCapability.REASONING));

    private final ModelCatalog catalog;
    private final CapabilityScorer scorer;

    public DefaultTaskAnalyzer(ModelCatalog catalog, CapabilityScorer scorer) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    @Override
    public TaskRequirements analyze(Task task) {
        Objects.requireNonNull(task, "task");
        TaskProfile profile = TaskProfile.forType(task.type());

        Map<ModelCapability, Double> minScores = new LinkedHashMap<>();
        minScores.put(profile.primary, PRIMARY_MIN_SCORE);
        for (ModelCapability secondary : profile.secondaries) {
            minScores.putIfAbsent(secondary, SECONDARY_MIN_SCORE);
        }

        TaskRequirements requirements = new TaskRequirements(
                profile.primary,
                profile.secondaries,
                minScores,
                contextSize(profile.baseContext, task.input()),
                task.priority() != null ? task.priority() : TaskPriority.QUALITY,
                task.resourceConstraints() != null ? task.resourceConstraints() : ResourceConstraints.defaults()
        );

        if (!validateRequirements(requirements)) {
            LOG.warn("Rejected task {}: derived requirements are invalid (constraints={})",
                    task.id(), requirements.resourceConstraints());
            throw new RequirementsValidationException("Invalid requirements generated", task.id());
        }
        LOG.debug("Analyzed task {} type={} primary={} contextSize={}",
                task.id(), task.type(), profile.primary.id(), requirements.contextSize());
        return requirements;
    }

    @Override
    public boolean validateRequirements(TaskRequirements requirements) {
        if (requirements == null) {
            return false;
        }
        if (requirements.primaryCapability() == null) {
            return false;
        }
        if (requirements.secondaryCapabilities() == null || requirements.secondaryCapabilities().isEmpty()) {
            return false;
        }
        if (requirements.minCapabilityScores() == null || requirements.minCapabilityScores().isEmpty()) {
            return false;
        }
        if (requirements.contextSize() <= 0) {
            return false;
        }
        if (requirements.priority() == null) {
            return false;
        }
        ResourceConstraints constraints = requirements.resourceConstraints();
        return constraints == null || constraints.isValid();
    }

    @Override
    public ModelChain suggestModelChain(TaskRequirements requirements) {
        Objects.requireNonNull(requirements, "requirements");
        ModelType planner = bestFor(ModelCapability.REASONING, DEFAULT_PLANNER);
        ModelType executor = bestFor(requirements.primaryCapability(), defaultExecutor(requirements.primaryCapability()));
        return new ModelChain(planner, executor);
    }

    private ModelType bestFor(ModelCapability capability, ModelType fallback) {
        List<ModelType> candidates = catalog.withCapability(capability);
        ModelType best = null;
        double bestScore = -1;
        for (ModelType candidate : candidates) {
            double score = scorer.getCapabilityScore(candidate.id(), capability);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best != null ? best : fallback;
    }

    private static ModelType defaultExecutor(ModelCapability capability) {
        return new ModelType("default-executor", "Default Execution Model", 0L, EnumSet.of(capability));
    }

    static int contextSize(int baseSize, Object input) {
        if (input == null) {
            return baseSize;
        }
        int length = JSONObject.valueToString(input).length();
        if (length > LARGE_INPUT_CHARS) {
            return Math.max(baseSize, (int) Math.ceil(length * INPUT_CONTEXT_FACTOR));
        }
        return baseSize;
    }

    /** Lookup row for one task type. */
    private enum TaskProfile {
        ARCHITECTURE("architecture", ModelCapability.REASONING, 4096,
                ModelCapability.ANALYSIS, ModelCapability.CODE, ModelCapability.REASONING),
        CODE_GENERATION("code_generation", ModelCapability.CODE, 2048,
                ModelCapability.ANALYSIS, ModelCapability.REASONING),
        TRANSCRIPTION("transcription", ModelCapability.TRANSCRIPTION, 2048,
                ModelCapability.ANALYSIS),
        SYNTHESIS("synthesis", ModelCapability.SYNTHESIS, 2048,
                ModelCapability.ANALYSIS),
        ANALYSIS("analysis", ModelCapability.ANALYSIS, 2048,
                ModelCapability.STREAMING, ModelCapability.REASONING),
        GENERAL("", ModelCapability.REASONING, 2048,
                ModelCapability.ANALYSIS, ModelCapability.REASONING);

        private final String type;
        private final ModelCapability primary;
        private final int baseContext;
        private final Set<ModelCapability> secondaries;

        TaskProfile(String type, ModelCapability primary, int baseContext, ModelCapability... secondaries) {
            this.type = type;
            this.primary = primary;
            this.baseContext = baseContext;
            this.secondaries = new LinkedHashSet<>(List.of(secondaries));
        }

        static TaskProfile forType(String type) {
            for (TaskProfile profile : values()) {
                if (profile != GENERAL && profile.type.equals(type)) {
                    return profile;
                }
            }
            return GENERAL;
        }
    }
}
