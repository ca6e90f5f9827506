package com.vitalwatch.common.exception;

/**
 * The sample store could not answer a query: transport failure, non-2xx status, unreadable
 * payload or timeout. Never used for "the store answered with no data".
 */
public class StoreUnavailableException extends RuntimeException {
    private final String deviceId;

    public StoreUnavailableException(String deviceId, String message) {
        super("[" + deviceId + "] " + message);
        this.deviceId = deviceId;
    }

    public StoreUnavailableException(String deviceId, String message, Throwable cause) {
        super("[" + deviceId + "] " + message, cause);
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
