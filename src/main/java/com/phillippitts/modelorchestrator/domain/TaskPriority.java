package com.phillippitts.modelorchestrator.domain;

/**
 * What a task optimizes for when models are chosen.
 */
public enum TaskPriority {
    SPEED,
    QUALITY,
    EFFICIENCY
}
