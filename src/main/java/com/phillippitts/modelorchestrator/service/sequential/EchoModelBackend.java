package com.phillippitts.modelorchestrator.service.sequential;

import com.phillippitts.modelorchestrator.domain.ModelType;
import com.phillippitts.modelorchestrator.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stand-in backend that loads nothing and describes each step it is asked to run.
 * Replace the {@link ModelBackend} bean to plug in a real runtime.
 */
public class EchoModelBackend implements ModelBackend {

    private static final Logger LOG = LogManager.getLogger(EchoModelBackend.class);
    private static final int PREVIEW_CHARS = 120;

    @Override
    public void load(ModelType model) {
        LOG.debug("Echo backend: load {}", model.id());
    }

    @Override
    public void unload(ModelType model) {
        LOG.debug("Echo backend: unload {}", model.id());
    }

    @Override
    public Object process(ModelType model, ProcessingStep step, Object input) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("model", model.id());
        output.put("operation", step.operation().id());
        output.put("capability", step.capability().id());
        if (input instanceof PlannedInput planned) {
            output.put("input", preview(planned.input()));
            output.put("plan", preview(planned.plan()));
        } else {
            output.put("input", preview(input));
        }
        return output;
    }

    private static String preview(Object value) {
        return LogSanitizer.truncate(value == null ? null : String.valueOf(value), PREVIEW_CHARS);
    }
}
