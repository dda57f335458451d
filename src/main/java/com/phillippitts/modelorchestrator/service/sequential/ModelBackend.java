package com.phillippitts.modelorchestrator.service.sequential;

import com.phillippitts.modelorchestrator.domain.ModelType;

/**
 * Runtime that actually hosts models. Calls arrive one at a time from the orchestrator's
 * model worker, so implementations need not be thread-safe.
 *
 * <p>Any runtime exception is treated as a backend failure and wrapped by the orchestrator.
 */
public interface ModelBackend {

    void load(ModelType model);

    void unload(ModelType model);

    /**
     * Runs one pipeline step.
     *
     * @param model loaded model
     * @param step  step being run
     * @param input task input, or the previous step's output
     * @return step output
     */
    Object process(ModelType model, ProcessingStep step, Object input);
}
