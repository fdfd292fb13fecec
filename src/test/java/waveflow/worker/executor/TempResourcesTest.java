package waveflow.worker.executor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import waveflow.worker.model.TaskInvocation;
import waveflow.worker.model.TaskKind;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TempResourcesTest {

    @TempDir
    Path root;

    @Test
    void namesAreUniqueAndScopedToInvocation() throws Exception {
        WorkArea area = new WorkArea(root.resolve("work"));
        TaskInvocation inv = TaskInvocation.builder().kind(TaskKind.MIX_STEMS).id("abc/../1").build();

        try (TempResources temp = area.open(inv)) {
            Path a = temp.newFile("stem", ".wav");
            Path b = temp.newFile("stem", ".wav");

            assertNotEquals(a, b);
            assertEquals(root.resolve("work"), a.getParent());
            assertTrue(a.getFileName().toString().startsWith("wf-mix_stems_and_upload-abc____1-"));
            assertTrue(a.getFileName().toString().endsWith("-stem.wav"));
        }
    }

    @Test
    void closeDeletesOwnedFilesOnly() throws Exception {
        WorkArea area = new WorkArea(root);
        Path foreign = Files.writeString(root.resolve("someone-else.wav"), "keep");
        TempResources temp = area.open(TaskInvocation.builder().kind(TaskKind.ANALYZE_AUDIO).id("i").build());
        Path created = Files.writeString(temp.newFile("source", ".wav"), "data");
        Path neverCreated = temp.newFile("waveform", ".json");

        temp.close();

        assertFalse(Files.exists(created));
        assertFalse(Files.exists(neverCreated));
        assertTrue(Files.exists(foreign));
        assertThrows(IllegalStateException.class, () -> temp.newFile("late", ".tmp"));
        temp.close();
    }
}
