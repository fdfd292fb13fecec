package waveflow.worker.dispatch;

import waveflow.worker.model.TaskInvocation;

/**
 * Result of {@link MessageDecoder#decode(String)}.
 */
public sealed interface DecodeResult {

    record Decoded(TaskInvocation invocation) implements DecodeResult {
    }

    record Malformed(MalformedReason reason, String detail) implements DecodeResult {
    }
}
