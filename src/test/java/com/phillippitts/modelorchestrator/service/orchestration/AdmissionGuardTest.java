package com.phillippitts.modelorchestrator.service.orchestration;

import com.phillippitts.modelorchestrator.exception.AdmissionRejectedException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class AdmissionGuardTest {

    @Test
    void tracksPermits() {
        AdmissionGuard guard = new AdmissionGuard(2, 10);

        guard.acquire();

        assertThat(guard.inFlight()).isEqualTo(1);
        assertThat(guard.availablePermits()).isEqualTo(1);

        guard.release();
        assertThat(guard.inFlight()).isZero();
    }

    @Test
    void rejectsWhenFullAfterTimeout() {
        AdmissionGuard guard = new AdmissionGuard(1, 20);
        guard.acquire();

        assertThatThrownBy(guard::acquire)
                .isInstanceOf(AdmissionRejectedException.class)
                .hasMessageContaining("limit (1)");
    }

    @Test
    void waitingCallerGetsReleasedPermit() {
        AdmissionGuard guard = new AdmissionGuard(1, 5_000);
        guard.acquire();

        CompletableFuture<Void> waiter = CompletableFuture.runAsync(guard::acquire);
        guard.release();

        await().atMost(2, TimeUnit.SECONDS).until(waiter::isDone);
        assertThat(waiter).isCompleted();
        assertThat(guard.inFlight()).isEqualTo(1);
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> new AdmissionGuard(0, 10)).isInstanceOf(IllegalArgumentException.class);
    }
}
