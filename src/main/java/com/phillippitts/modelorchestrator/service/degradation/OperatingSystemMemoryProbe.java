package com.phillippitts.modelorchestrator.service.degradation;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Reads physical memory from the platform {@code OperatingSystemMXBean}.
 *
 * <p>Falls back to the JVM heap figures when the platform bean does not expose physical memory.
 */
public class OperatingSystemMemoryProbe implements MemoryProbe {

    private final OperatingSystemMXBean osBean;

    public OperatingSystemMemoryProbe() {
        this(ManagementFactory.getOperatingSystemMXBean());
    }

    OperatingSystemMemoryProbe(OperatingSystemMXBean osBean) {
        this.osBean = osBean;
    }

    @Override
    public long totalMemory() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            return sunBean.getTotalMemorySize();
        }
        return Runtime.getRuntime().maxMemory();
    }

    @Override
    public long freeMemory() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            return sunBean.getFreeMemorySize();
        }
        Runtime rt = Runtime.getRuntime();
        return rt.maxMemory() - (rt.totalMemory() - rt.freeMemory());
    }
}
