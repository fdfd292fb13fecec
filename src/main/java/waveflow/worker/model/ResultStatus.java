package waveflow.worker.model;

/**
 * Status carried by a processing result and its webhook payload.
 */
public enum ResultStatus {
    SUCCESS,
    FAILURE
}
