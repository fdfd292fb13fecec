package waveflow.worker.cleanup;

/**
 * Totals of one sweep over the work area.
 */
public record SweepResult(int scanned, int deleted, long bytesReclaimed, int failures) {

    public static final SweepResult EMPTY = new SweepResult(0, 0, 0, 0);
}
