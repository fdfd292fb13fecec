package waveflow.worker.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TaskKindTest {

    @Test
    void resolvesProducerNames() {
        assertEquals(Optional.of(TaskKind.ANALYZE_AUDIO), TaskKind.fromWireName("app.tasks.process_audio_analysis"));
        assertEquals(Optional.of(TaskKind.MIX_STEMS), TaskKind.fromWireName("mix_stems_and_upload"));
        assertEquals(Optional.of(TaskKind.HEALTH_CHECK), TaskKind.fromWireName("worker.health_check"));
        assertEquals(Optional.of(TaskKind.DELETE_DUPLICATE), TaskKind.fromWireName("delete_duplicate"));
    }

    @Test
    void unknownNamesResolveToNothing() {
        assertTrue(TaskKind.fromWireName("app.tasks.transcode_video").isEmpty());
        assertTrue(TaskKind.fromWireName("").isEmpty());
        assertTrue(TaskKind.fromWireName(null).isEmpty());
    }

    @Test
    void maintenanceKindsAreNotRetried() {
        assertFalse(TaskKind.HEALTH_CHECK.retryable());
        assertFalse(TaskKind.CLEANUP_TEMP.retryable());
        assertTrue(TaskKind.HASH_AND_NOTIFY.retryable());
    }
}
