package com.scanq.scan;

/**
 * External scan operation for one {@link ScanType}. Implementations must be idempotent: the
 * queue and the retry executor may invoke them more than once for the same target.
 * Register implementations as Spring beans to have them picked up by {@link ScanWorkerRegistry}.
 */
public interface ScanWorker {

    /**
     * The scan type this worker runs. {@link ScanType#FULL} is composite and cannot be
     * registered directly.
     */
    ScanType getScanType();

    /**
     * Runs the scan. A returned result with {@code success=false} is treated as a failure by
     * {@link ScanDispatcher}; thrown exceptions are classified and possibly retried.
     *
     * @param request target and options
     * @return the outcome reported by the warehouse
     * @throws Exception if the scan could not be run
     */
    ScanResult run(ScanRequest request) throws Exception;
}
