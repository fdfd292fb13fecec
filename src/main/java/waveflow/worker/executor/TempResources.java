package waveflow.worker.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Local files owned by one attempt of one invocation. Closing deletes all of them;
 * a delete failure is logged and never escalated.
 */
public final class TempResources implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TempResources.class);

    private final Path dir;
    private final String prefix;
    private final List<Path> owned = new ArrayList<>();
    private boolean closed;

    TempResources(Path dir, String prefix) {
        this.dir = dir;
        this.prefix = prefix;
    }

    /**
     * Reserve a unique path for this invocation. The file itself is not created.
     *
     * @param label  short role name, e.g. {@code source} or {@code mixed}
     * @param suffix file extension including the dot
     */
    public synchronized Path newFile(String label, String suffix) {
        if (closed) {
            throw new IllegalStateException("temp resources already released");
        }
        String unique = UUID.randomUUID().toString().substring(0, 8);
        Path path = dir.resolve(prefix + "-" + unique + "-" + WorkArea.sanitize(label) + suffix);
        owned.add(path);
        return path;
    }

    public synchronized List<Path> files() {
        return List.copyOf(owned);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        int deleted = 0;
        for (Path path : owned) {
            try {
                if (Files.deleteIfExists(path)) {
                    deleted++;
                }
            } catch (IOException e) {
                log.warn("Could not delete temp file {}: {}", path, e.toString());
            }
        }
        if (deleted > 0) {
            log.debug("Released {} temp file(s) for {}", deleted, prefix);
        }
    }
}
