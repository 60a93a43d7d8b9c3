package com.scanq.scan;

/**
 * Raised when a scan operation reports {@code success=false}.
 */
public class ScanFailedException extends RuntimeException {

    private final ScanType scanType;
    private final ScanTarget target;

    public ScanFailedException(ScanType scanType, ScanTarget target, String error) {
        super(error == null || error.isBlank()
                ? scanType.value() + " scan failed for " + target
                : error);
        this.scanType = scanType;
        this.target = target;
    }

    public ScanType getScanType() {
        return scanType;
    }

    public ScanTarget getTarget() {
        return target;
    }
}
