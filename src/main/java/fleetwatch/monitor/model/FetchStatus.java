package fleetwatch.monitor.model;

/**
 * Outcome of fetching one metric window for one instance.
 */
public enum FetchStatus {
    /** Samples were returned (possibly none) */
    OK,

    /** The instance no longer exists and must be dropped from tracking */
    NOT_FOUND,

    /** The backend kept failing transiently until the retry budget ran out */
    RETRIES_EXHAUSTED,

    /** Non-retryable failure for this (instance, metric) pair */
    FAILED
}
