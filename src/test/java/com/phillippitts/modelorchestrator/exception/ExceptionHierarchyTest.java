package com.phillippitts.modelorchestrator.exception;

import com.phillippitts.modelorchestrator.domain.ResourceMap;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void orchestrationExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        OrchestrationException ex = new OrchestrationException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
        assertThat(ex).isInstanceOf(RuntimeException.class);
    }

    @Test
    void insufficientMemoryExceptionShouldCarryAmounts() {
        InsufficientMemoryException ex = new InsufficientMemoryException("big-model", 2048L, 1024L);

        assertThat(ex.getMessage()).startsWith("Insufficient memory to load model big-model");
        assertThat(ex.getModelId()).isEqualTo("big-model");
        assertThat(ex.getRequiredBytes()).isEqualTo(2048L);
        assertThat(ex.getAvailableBytes()).isEqualTo(1024L);
        assertThat(ex).isInstanceOf(OrchestrationException.class);
    }

    @Test
    void allocationInfeasibleExceptionShouldIncludeReasonAndAttempt() {
        ResourceMap attempted = new ResourceMap(100, 0.5, 10);
        AllocationInfeasibleException ex = new AllocationInfeasibleException(
                "Resources unavailable", attempted, AllocationInfeasibleException.Reason.CAPACITY);

        assertThat(ex.getMessage()).startsWith("Resources unavailable").contains("reason=CAPACITY");
        assertThat(ex.getAttempted()).isEqualTo(attempted);
        assertThat(ex.getReason()).isEqualTo(AllocationInfeasibleException.Reason.CAPACITY);
        assertThat(ex).isInstanceOf(OrchestrationException.class);
    }

    @Test
    void requirementsValidationExceptionShouldIncludeTaskId() {
        RequirementsValidationException ex = new RequirementsValidationException("Invalid requirements generated", "t-1");

        assertThat(ex.getMessage()).isEqualTo("Invalid requirements generated");
        assertThat(ex.getTaskId()).isEqualTo("t-1");
    }

    @Test
    void modelProcessingExceptionShouldIncludeModelId() {
        ModelProcessingException ex = new ModelProcessingException("Step failed", "whisper-small");

        assertThat(ex.getMessage()).isEqualTo("Step failed (model: whisper-small)");
        assertThat(ex.getModelId()).isEqualTo("whisper-small");
    }

    @Test
    void modelProcessingExceptionWithoutModelShouldReportUnknown() {
        ModelProcessingException ex = new ModelProcessingException("Step failed", new IllegalStateException());

        assertThat(ex.getModelId()).isEqualTo("unknown");
        assertThat(ex.getCause()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void admissionRejectedExceptionShouldCarryWaitTime() {
        AdmissionRejectedException ex = new AdmissionRejectedException("limit reached", 250L);

        assertThat(ex.getMessage()).isEqualTo("limit reached");
        assertThat(ex.getWaitedMs()).isEqualTo(250L);
        assertThat(ex).isInstanceOf(OrchestrationException.class);
    }
}
