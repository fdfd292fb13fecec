package waveflow.worker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome payload of one task invocation. Never persisted: returned in-process
 * and optionally serialized into a webhook.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingResult(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("task") TaskKind kind,
        @JsonProperty("status") ResultStatus status,
        @JsonProperty("result") Map<String, Object> result,
        @JsonProperty("error_code") String errorCode,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("processed_at") Instant processedAt) {

    public static ProcessingResult success(String taskId, TaskKind kind, Map<String, Object> result) {
        return new ProcessingResult(taskId, kind, ResultStatus.SUCCESS, result, null, null, Instant.now());
    }

    public static ProcessingResult failure(String taskId, TaskKind kind, String errorCode, String errorMessage) {
        return new ProcessingResult(taskId, kind, ResultStatus.FAILURE, Map.of(), errorCode, errorMessage,
                Instant.now());
    }

    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }
}
