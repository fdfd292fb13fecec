package waveflow.worker.model;

import java.util.Objects;

/**
 * Immutable unit of work decoded from a queue message.
 * The id is stable across retries of the same invocation; the attempt counter is not.
 */
public final class TaskInvocation {

    public static final String UNKNOWN_ID = "unknown";

    private final String kindName;
    private final String id;
    private final TaskArgs args;
    private final int attempt;

    private TaskInvocation(Builder builder) {
        this.kindName = Objects.requireNonNull(builder.kindName, "kindName is required");
        this.id = builder.id == null || builder.id.isBlank() ? UNKNOWN_ID : builder.id;
        this.args = builder.args == null ? TaskArgs.empty() : builder.args;
        if (builder.attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative");
        }
        this.attempt = builder.attempt;
    }

    /** Task name exactly as it appeared on the wire. */
    public String kindName() {
        return kindName;
    }

    public String id() {
        return id;
    }

    public TaskArgs args() {
        return args;
    }

    public int attempt() {
        return attempt;
    }

    /** Same invocation, next attempt. */
    public TaskInvocation nextAttempt() {
        return toBuilder().attempt(attempt + 1).build();
    }

    public TaskInvocation withAttempt(int attempt) {
        return toBuilder().attempt(attempt).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .kindName(kindName)
                .id(id)
                .args(args)
                .attempt(attempt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String kindName;
        private String id;
        private TaskArgs args;
        private int attempt = 0;

        public Builder kindName(String kindName) {
            this.kindName = kindName;
            return this;
        }

        public Builder kind(TaskKind kind) {
            this.kindName = kind.wireName();
            return this;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder args(TaskArgs args) {
            this.args = args;
            return this;
        }

        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }

        public TaskInvocation build() {
            return new TaskInvocation(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskInvocation other))
            return false;
        return attempt == other.attempt
                && kindName.equals(other.kindName)
                && id.equals(other.id)
                && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kindName, id, args, attempt);
    }

    @Override
    public String toString() {
        return "TaskInvocation{kind='" + kindName + "', id='" + id + "', attempt=" + attempt + "}";
    }
}
