package waveflow.worker.dispatch;

import org.junit.jupiter.api.Test;
import waveflow.worker.executor.TaskHandler;
import waveflow.worker.executor.TaskOutcome;
import waveflow.worker.model.ProcessingResult;
import waveflow.worker.model.TaskKind;
import waveflow.worker.support.ScriptedHandler;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskRouterTest {

    private static ScriptedHandler handler(TaskKind kind) {
        return new ScriptedHandler(kind,
                inv -> new TaskOutcome.Success(ProcessingResult.success(inv.id(), kind, Map.of())));
    }

    private static TaskRouter fullRouter() {
        return new TaskRouter(handler(TaskKind.HASH_AND_NOTIFY), handler(TaskKind.DELETE_DUPLICATE),
                handler(TaskKind.ANALYZE_AUDIO), handler(TaskKind.MIX_STEMS), handler(TaskKind.HEALTH_CHECK),
                handler(TaskKind.CLEANUP_TEMP));
    }

    @Test
    void resolvesEveryWireName() {
        TaskRouter router = fullRouter();

        for (TaskKind kind : TaskKind.values()) {
            TaskHandler resolved = router.resolve(kind.wireName()).orElseThrow();
            assertEquals(kind, resolved.kind());
        }
    }

    @Test
    void acceptsShortNameAndEnumName() {
        TaskRouter router = fullRouter();

        assertEquals(TaskKind.MIX_STEMS, router.resolve("mix_stems_and_upload").orElseThrow().kind());
        assertEquals(TaskKind.ANALYZE_AUDIO, router.resolve("analyze_audio").orElseThrow().kind());
        assertEquals(TaskKind.HEALTH_CHECK, router.resolve("app.tasks.health_check").orElseThrow().kind());
    }

    @Test
    void unknownKindResolvesToNothing() {
        TaskRouter router = fullRouter();

        assertTrue(router.resolve("app.tasks.transcode_video").isEmpty());
        assertTrue(router.resolve("X").isEmpty());
        assertTrue(router.resolve("").isEmpty());
    }

    @Test
    void rejectsHandlerOfWrongKind() {
        assertThrows(IllegalArgumentException.class, () -> new TaskRouter(
                handler(TaskKind.HASH_AND_NOTIFY), handler(TaskKind.HASH_AND_NOTIFY),
                handler(TaskKind.ANALYZE_AUDIO), handler(TaskKind.MIX_STEMS), handler(TaskKind.HEALTH_CHECK),
                handler(TaskKind.CLEANUP_TEMP)));
    }
}
