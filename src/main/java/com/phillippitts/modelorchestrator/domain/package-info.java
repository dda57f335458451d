/**
 * Immutable domain types shared by the orchestration services.
 *
 * <p>Records in this package carry no behaviour beyond argument checks and small value helpers.
 * Mutable state (performance history, the resource pool, the loaded-model slot) lives in the
 * owning services.
 *
 * @since 1.0
 */
package com.phillippitts.modelorchestrator.domain;
