package com.phillippitts.modelorchestrator.service.analysis;

import com.phillippitts.modelorchestrator.domain.ModelCapability;
import com.phillippitts.modelorchestrator.domain.ModelType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered set of models the orchestrator knows how to load.
 * Declaration order is the tie-breaker wherever two models score the same.
 */
public final class ModelCatalog {

    private final Map<String, ModelType> models;

    public ModelCatalog(List<ModelType> models) {
        Map<String, ModelType> byId = new LinkedHashMap<>();
        for (ModelType model : models) {
            if (byId.putIfAbsent(model.id(), model) != null) {
                throw new IllegalArgumentException("Duplicate model id in catalog: " + model.id());
            }
        }
        this.models = Collections.unmodifiableMap(byId);
    }

    public List<ModelType> all() {
        return List.copyOf(models.values());
    }

    public Optional<ModelType> find(String modelId) {
        return Optional.ofNullable(models.get(modelId));
    }

    /** Models offering {@code capability}, in catalog order. */
    public List<ModelType> withCapability(ModelCapability capability) {
        List<ModelType> matches = new ArrayList<>();
        for (ModelType model : models.values()) {
            if (model.hasCapability(capability)) {
                matches.add(model);
            }
        }
        return matches;
    }

    public int size() {
        return models.size();
    }
}
