package waveflow.worker.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import waveflow.worker.model.TaskKind;
import waveflow.worker.support.InMemoryMessageQueue;
import waveflow.worker.support.InMemoryObjectStore;
import waveflow.worker.support.RecordingNotifier;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DependenciesTest {

    @TempDir
    Path tempDir;

    private WorkerConfig config() {
        return WorkerConfig.defaults()
                .withQueueUrl("memory://queue")
                .withBucketName("bucket")
                .withWebhookUrl("http://localhost/webhooks")
                .withTempDir(tempDir)
                .withPollers(2)
                .withPollWait(Duration.ZERO)
                .withCleanupInterval(Duration.ZERO)
                .withHealthPort(0);
    }

    @Test
    void wiresAHandlerForEveryKind() {
        try (Dependencies deps = Dependencies.create(config(), new InMemoryObjectStore(),
                new InMemoryMessageQueue(), new RecordingNotifier())) {
            for (TaskKind kind : TaskKind.values()) {
                assertEquals(kind, deps.taskRouter().handlerFor(kind).kind());
            }
            assertNotNull(deps.newConsumer("a"));
            assertNotSame(deps.newConsumer("a"), deps.newConsumer("b"));
        }
    }

    @Test
    void startsAndStopsPollersWithoutStatusServer() {
        Dependencies deps = Dependencies.create(config(), new InMemoryObjectStore(), new InMemoryMessageQueue(),
                new RecordingNotifier());

        deps.start();
        assertTrue(deps.consumerPool().isRunning());
        assertTrue(deps.scheduler().isRunning());
        assertFalse(deps.healthServer().isRunning());

        deps.close();
        assertFalse(deps.consumerPool().isRunning());
        assertFalse(deps.scheduler().isRunning());
    }
}
