package waveflow.worker.consumer;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.concurrent.atomic.LongAdder;

/**
 * Counters shared by all pollers of one worker.
 */
public final class ConsumerStats {

    final LongAdder received = new LongAdder();
    final LongAdder succeeded = new LongAdder();
    final LongAdder retried = new LongAdder();
    final LongAdder exhausted = new LongAdder();
    final LongAdder malformed = new LongAdder();
    final LongAdder unknownKind = new LongAdder();
    final LongAdder idlePolls = new LongAdder();
    final LongAdder pollErrors = new LongAdder();

    public Snapshot snapshot() {
        return new Snapshot(received.sum(), succeeded.sum(), retried.sum(), exhausted.sum(), malformed.sum(),
                unknownKind.sum(), idlePolls.sum(), pollErrors.sum());
    }

    public record Snapshot(
            @JsonProperty("received") long received,
            @JsonProperty("succeeded") long succeeded,
            @JsonProperty("retried") long retried,
            @JsonProperty("exhausted") long exhausted,
            @JsonProperty("malformed") long malformed,
            @JsonProperty("unknown_kind") long unknownKind,
            @JsonProperty("idle_polls") long idlePolls,
            @JsonProperty("poll_errors") long pollErrors) {

        @Override
        public String toString() {
            return "received=" + received + " succeeded=" + succeeded + " retried=" + retried
                    + " exhausted=" + exhausted + " malformed=" + malformed + " unknown=" + unknownKind
                    + " idle=" + idlePolls + " pollErrors=" + pollErrors;
        }
    }
}
