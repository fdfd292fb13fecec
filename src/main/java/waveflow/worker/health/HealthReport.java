package waveflow.worker.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Snapshot of connectivity and local resource usage. A failed probe is a string, never an exception.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthReport(
        @JsonProperty("status") String status,
        @JsonProperty("storage") String storage,
        @JsonProperty("queue") String queue,
        @JsonProperty("heap_used_percent") Double heapUsedPercent,
        @JsonProperty("memory_used_percent") Double systemMemoryPercent,
        @JsonProperty("process_cpu_percent") Double processCpuPercent,
        @JsonProperty("system_cpu_percent") Double systemCpuPercent,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("checked_at") Instant checkedAt) {

    public static final String OK = "ok";

    public boolean healthy() {
        return "healthy".equals(status);
    }
}
