/**
 * Request correlation for logs.
 */
package com.phillippitts.modelorchestrator.config.logging;
