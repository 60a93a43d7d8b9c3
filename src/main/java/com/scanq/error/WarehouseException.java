package com.scanq.error;

/**
 * Failure reported by the data warehouse, optionally carrying the vendor error code
 * (for example {@code 390100} for invalid credentials).
 */
public class WarehouseException extends RuntimeException {

    private final String vendorCode;

    public WarehouseException(String message) {
        this(message, null, null);
    }

    public WarehouseException(String message, String vendorCode) {
        this(message, vendorCode, null);
    }

    public WarehouseException(String message, String vendorCode, Throwable cause) {
        super(message, cause);
        this.vendorCode = vendorCode;
    }

    public String getVendorCode() {
        return vendorCode;
    }
}
