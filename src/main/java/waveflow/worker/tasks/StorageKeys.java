package waveflow.worker.tasks;

import waveflow.worker.model.TaskInvocation;

/**
 * Derived object keys. Built from the invocation id so every retry of one
 * invocation writes to the same key.
 */
public final class StorageKeys {

    private StorageKeys() {
    }

    public static String waveform(String stemId, TaskInvocation invocation) {
        return "waveforms/" + stemId + "_waveform_" + invocation.id() + ".json";
    }

    public static String mixed(String stageId, TaskInvocation invocation) {
        return "mixed/" + stageId + "_mixed_" + invocation.id() + ".wav";
    }

    public static String mixedWaveform(String stageId, TaskInvocation invocation) {
        return "waveforms/" + stageId + "_mixed_waveform_" + invocation.id() + ".json";
    }

    /** File extension of a key including the dot, or {@code .bin}. */
    public static String extension(String key) {
        int slash = key.lastIndexOf('/');
        int dot = key.lastIndexOf('.');
        if (dot <= slash || dot == key.length() - 1) {
            return ".bin";
        }
        String ext = key.substring(dot).toLowerCase();
        return ext.matches("\\.[a-z0-9]{1,5}") ? ext : ".bin";
    }
}
