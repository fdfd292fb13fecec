package waveflow.worker.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import waveflow.worker.consumer.ConsumerStats;

/**
 * Response DTO for consumer stats.
 * GET /api/v1/stats
 */
public record StatsResponse(
        @JsonProperty("pollers") int pollers,
        @JsonProperty("uptime_seconds") long uptimeSeconds,
        @JsonProperty("counters") ConsumerStats.Snapshot counters) {
}
