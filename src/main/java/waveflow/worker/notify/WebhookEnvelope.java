package waveflow.worker.notify;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import waveflow.worker.model.ResultStatus;
import waveflow.worker.model.TaskInvocation;

import java.time.Instant;
import java.util.Map;

/**
 * JSON body of every webhook callback.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookEnvelope(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("task") String task,
        @JsonProperty("status") ResultStatus status,
        @JsonProperty("result") Map<String, Object> result,
        @JsonProperty("error") ErrorInfo error,
        @JsonProperty("timestamp") Instant timestamp) {

    public static WebhookEnvelope success(String jobId, TaskInvocation invocation, Map<String, Object> result) {
        return new WebhookEnvelope(jobId, invocation.id(), invocation.kindName(), ResultStatus.SUCCESS,
                result, null, Instant.now());
    }

    public static WebhookEnvelope failure(String jobId, TaskInvocation invocation, String code, String message) {
        return new WebhookEnvelope(jobId, invocation.id(), invocation.kindName(), ResultStatus.FAILURE,
                Map.of(), new ErrorInfo(code, message), Instant.now());
    }

    public record ErrorInfo(
            @JsonProperty("code") String code,
            @JsonProperty("message") String message) {
    }
}
