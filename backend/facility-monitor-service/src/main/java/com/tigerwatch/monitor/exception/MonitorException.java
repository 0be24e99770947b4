package com.tigerwatch.monitor.exception;

/**
 * 모니터링 파이프라인 예외 기본 클래스
 */
public class MonitorException extends RuntimeException {

    private final String errorCode;
    private final String facilityId;

    public MonitorException(String message) {
        super(message);
        this.errorCode = "MONITOR_ERROR";
        this.facilityId = null;
    }

    public MonitorException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "MONITOR_ERROR";
        this.facilityId = null;
    }

    public MonitorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.facilityId = null;
    }

    public MonitorException(String errorCode, String message, String facilityId) {
        super(message);
        this.errorCode = errorCode;
        this.facilityId = facilityId;
    }

    public MonitorException(String errorCode, String message, String facilityId, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.facilityId = facilityId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getFacilityId() {
        return facilityId;
    }
}
