package com.phillippitts.modelorchestrator.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the sequential model orchestrator.
 *
 * <ul>
 *   <li>orchestrator.sequential.memory-limit-bytes - hard ceiling for the loaded model (default: 16 GiB)</li>
 *   <li>orchestrator.sequential.auto-load - hand off to a capable model when the loaded one
 *       cannot serve a step (default: true)</li>
 *   <li>orchestrator.sequential.planning - run a planning step on the suggested planner model
 *       ahead of the pipeline (default: true)</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "orchestrator.sequential")
public class SequentialProperties {

    @Positive
    private long memoryLimitBytes = 16L * 1024 * 1024 * 1024;

    private boolean autoLoad = true;

    private boolean planning = true;

    public long getMemoryLimitBytes() {
        return memoryLimitBytes;
    }

    public void setMemoryLimitBytes(long memoryLimitBytes) {
        this.memoryLimitBytes = memoryLimitBytes;
    }

    public boolean isAutoLoad() {
        return autoLoad;
    }

    public void setAutoLoad(boolean autoLoad) {
        this.autoLoad = autoLoad;
    }

    public boolean isPlanning() {
        return planning;
    }

    public void setPlanning(boolean planning) {
        this.planning = planning;
    }
}
