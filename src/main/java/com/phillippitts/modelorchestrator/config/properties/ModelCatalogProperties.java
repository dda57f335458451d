package com.phillippitts.modelorchestrator.config.properties;

import com.phillippitts.modelorchestrator.domain.ModelCapability;
import com.phillippitts.modelorchestrator.domain.ModelType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Models the orchestrator may load, in preference order.
 *
 * <pre>
 * orchestrator.catalog.models[0].id=whisper-small
 * orchestrator.catalog.models[0].memory-requirement-bytes=2147483648
 * orchestrator.catalog.models[0].capabilities=transcription,analysis
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "orchestrator.catalog")
public class ModelCatalogProperties {

    @Valid
    private List<ModelDefinition> models = new ArrayList<>();

    public List<ModelDefinition> getModels() {
        return models;
    }

    public void setModels(List<ModelDefinition> models) {
        this.models = models;
    }

    /** Converts the bound definitions to immutable descriptors, keeping declaration order. */
    public List<ModelType> toModelTypes() {
        List<ModelType> types = new ArrayList<>(models.size());
        for (ModelDefinition def : models) {
            types.add(def.toModelType());
        }
        return types;
    }

    /**
     * One catalog entry.
     */
    public static class ModelDefinition {
        @NotBlank
        private String id;
        private String name;
        @PositiveOrZero
        private long memoryRequirementBytes;
        private Set<ModelCapability> capabilities = new LinkedHashSet<>();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public long getMemoryRequirementBytes() {
            return memoryRequirementBytes;
        }

        public void setMemoryRequirementBytes(long memoryRequirementBytes) {
            this.memoryRequirementBytes = memoryRequirementBytes;
        }

        public Set<ModelCapability> getCapabilities() {
            return capabilities;
        }

        public void setCapabilities(Set<ModelCapability> capabilities) {
            this.capabilities = capabilities;
        }

        ModelType toModelType() {
            Set<ModelCapability> caps = capabilities == null || capabilities.isEmpty()
                    ? EnumSet.noneOf(ModelCapability.class)
                    : EnumSet.copyOf(capabilities);
            return new ModelType(id, name, memoryRequirementBytes, caps);
        }
    }
}
