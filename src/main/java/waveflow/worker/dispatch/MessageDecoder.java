package waveflow.worker.dispatch;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import waveflow.worker.dispatch.DecodeResult.Decoded;
import waveflow.worker.dispatch.DecodeResult.Malformed;
import waveflow.worker.model.TaskArgs;
import waveflow.worker.model.TaskInvocation;
import waveflow.worker.util.Json;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a raw queue body into a {@link TaskInvocation}.
 * <p>
 * Two producer shapes are accepted:
 * <ul>
 * <li>wrapped: {@code {"headers":{"task":..,"id":..,"retries":..},"body":"[[args],{kwargs}]"}}</li>
 * <li>direct: {@code {"task":..,"id":..,"kwargs":{..}}}, or bare domain fields that become the
 * arguments of the default task</li>
 * </ul>
 * Each shape is bound to its own typed envelope before normalization.
 */
public class MessageDecoder {

    private final ObjectMapper mapper;
    private final String defaultKind;

    public MessageDecoder(String defaultKind) {
        this(Json.mapper(), defaultKind);
    }

    MessageDecoder(ObjectMapper mapper, String defaultKind) {
        this.mapper = mapper;
        this.defaultKind = defaultKind;
    }

    public DecodeResult decode(String body) {
        return decode(body, 1);
    }

    /**
     * @param receiveCount broker delivery count; a redelivered message is at least attempt
     *                     {@code receiveCount - 1}
     */
    public DecodeResult decode(String body, int receiveCount) {
        return decode(body, receiveCount, null);
    }

    /**
     * @param fallbackId invocation id to use when the envelope carries none, normally the
     *                   broker's message id; may be null
     */
    public DecodeResult decode(String body, int receiveCount, String fallbackId) {
        if (body == null || body.isBlank()) {
            return new Malformed(MalformedReason.EMPTY, "empty body");
        }

        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            return new Malformed(MalformedReason.INVALID_JSON, e.getOriginalMessage());
        }

        if (isDegenerate(root)) {
            return new Malformed(MalformedReason.DEGENERATE, "degenerate body: " + body.trim());
        }
        if (!root.isObject()) {
            return new Malformed(MalformedReason.INVALID_ENVELOPE, "expected a JSON object, got " + root.getNodeType());
        }

        int redeliveries = Math.max(0, receiveCount - 1);
        if (root.path("headers").hasNonNull("task")) {
            return decodeWrapped(root, redeliveries, fallbackId);
        }
        return decodeDirect(root, redeliveries, fallbackId);
    }

    private DecodeResult decodeWrapped(JsonNode root, int redeliveries, String fallbackId) {
        WrappedEnvelope envelope;
        try {
            envelope = mapper.treeToValue(root, WrappedEnvelope.class);
        } catch (JsonProcessingException e) {
            return new Malformed(MalformedReason.INVALID_ENVELOPE, e.getOriginalMessage());
        }

        Map<String, Object> kwargs = Map.of();
        if (envelope.body() != null && !envelope.body().isBlank()) {
            try {
                JsonNode payload = mapper.readTree(envelope.body());
                if (!payload.isArray()) {
                    return new Malformed(MalformedReason.INVALID_ENVELOPE, "wrapped body is not an [args, kwargs] array");
                }
                JsonNode kw = payload.path(1);
                if (kw.isObject()) {
                    kwargs = mapper.convertValue(kw, Json.MAP_TYPE);
                }
            } catch (JsonProcessingException e) {
                return new Malformed(MalformedReason.INVALID_ENVELOPE, "wrapped body: " + e.getOriginalMessage());
            }
        }

        WrappedHeaders headers = envelope.headers();
        int retries = headers.retries() == null ? 0 : Math.max(0, headers.retries());
        return new Decoded(TaskInvocation.builder()
                .kindName(headers.task())
                .id(idOr(headers.id(), fallbackId))
                .args(TaskArgs.of(kwargs))
                .attempt(Math.max(retries, redeliveries))
                .build());
    }

    private DecodeResult decodeDirect(JsonNode root, int redeliveries, String fallbackId) {
        DirectEnvelope envelope;
        try {
            envelope = mapper.treeToValue(root, DirectEnvelope.class);
        } catch (JsonProcessingException e) {
            return new Malformed(MalformedReason.INVALID_ENVELOPE, e.getOriginalMessage());
        }

        Map<String, Object> args;
        int retries = 0;
        if (envelope.kwargs() != null) {
            args = envelope.kwargs();
            retries = envelope.retries() == null ? 0 : Math.max(0, envelope.retries());
        } else {
            args = new LinkedHashMap<>(mapper.convertValue(root, Json.MAP_TYPE));
            args.remove("task");
            args.remove("id");
        }

        String kind = envelope.task() == null || envelope.task().isBlank() ? defaultKind : envelope.task();
        return new Decoded(TaskInvocation.builder()
                .kindName(kind)
                .id(idOr(envelope.id(), fallbackId))
                .args(TaskArgs.of(args))
                .attempt(Math.max(retries, redeliveries))
                .build());
    }

    private static String idOr(String id, String fallbackId) {
        return id == null || id.isBlank() ? fallbackId : id;
    }

    private static boolean isDegenerate(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return true;
        }
        if (node.isTextual()) {
            return node.asText().isEmpty();
        }
        return (node.isObject() || node.isArray()) && node.isEmpty();
    }

    record WrappedEnvelope(
            @JsonProperty("headers") WrappedHeaders headers,
            @JsonProperty("body") String body) {
    }

    record WrappedHeaders(
            @JsonProperty("task") String task,
            @JsonProperty("id") String id,
            @JsonProperty("retries") Integer retries) {
    }

    record DirectEnvelope(
            @JsonProperty("task") String task,
            @JsonProperty("id") String id,
            @JsonProperty("kwargs") Map<String, Object> kwargs,
            @JsonProperty("retries") Integer retries) {
    }
}
