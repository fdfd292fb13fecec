package waveflow.worker.executor;

import waveflow.worker.model.TaskInvocation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Local directory shared by all invocations of this worker. Files inside are owned
 * by the invocation that created them.
 */
public final class WorkArea {

    private final Path root;

    public WorkArea(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    /**
     * Open a scope for one attempt of {@code invocation}. Creates the directory if needed.
     */
    public TempResources open(TaskInvocation invocation) throws IOException {
        Files.createDirectories(root);
        String kind = invocation.kindName().substring(invocation.kindName().lastIndexOf('.') + 1);
        return new TempResources(root, "wf-" + sanitize(kind) + "-" + sanitize(invocation.id()));
    }

    static String sanitize(String s) {
        String cleaned = s.replaceAll("[^A-Za-z0-9_]", "_");
        return cleaned.length() > 40 ? cleaned.substring(0, 40) : cleaned;
    }
}
