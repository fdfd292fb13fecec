package waveflow.worker.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.queue.MessageQueue;
import waveflow.worker.queue.QueueException;
import waveflow.worker.storage.ObjectStore;
import waveflow.worker.storage.StorageUnavailableException;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.time.Duration;
import java.time.Instant;

/**
 * Probes storage and queue reachability plus JVM and host resource usage.
 */
public class HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HealthProbe.class);

    private final ObjectStore store;
    private final MessageQueue queue;

    public HealthProbe(ObjectStore store, MessageQueue queue) {
        this.store = store;
        this.queue = queue;
    }

    public HealthReport check() {
        String storage = HealthReport.OK;
        try {
            store.probe();
        } catch (StorageUnavailableException e) {
            storage = "error: " + e.getMessage();
            log.warn("Storage probe failed: {}", e.getMessage());
        }

        String queueStatus = HealthReport.OK;
        try {
            queue.probe();
        } catch (QueueException e) {
            queueStatus = "error: " + e.getMessage();
            log.warn("Queue probe failed: {}", e.getMessage());
        }

        boolean healthy = HealthReport.OK.equals(storage) && HealthReport.OK.equals(queueStatus);

        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long heapMax = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        Double heapPercent = heapMax > 0 ? percent(heap.getUsed(), heapMax) : null;

        Double memoryPercent = null;
        Double processCpu = null;
        Double systemCpu = null;
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            long total = sunOs.getTotalMemorySize();
            if (total > 0) {
                memoryPercent = percent(total - sunOs.getFreeMemorySize(), total);
            }
            processCpu = cpuPercent(sunOs.getProcessCpuLoad());
            systemCpu = cpuPercent(sunOs.getCpuLoad());
        }

        return new HealthReport(healthy ? "healthy" : "unhealthy", storage, queueStatus, heapPercent,
                memoryPercent, processCpu, systemCpu, formatUptime(), Instant.now());
    }

    private static Double cpuPercent(double load) {
        return load < 0 ? null : round(load * 100.0);
    }

    private static double percent(long part, long whole) {
        return round(part * 100.0 / whole);
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    private static String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
