package com.tigerwatch.monitor.exception;

/**
 * 크롤링 작업 분배 실패 (큐 백엔드 오류, 종료 중 등)
 */
public class DispatchException extends MonitorException {

    public DispatchException(String facilityId, String message) {
        super("DISPATCH_ERROR", message, facilityId);
    }

    public DispatchException(String facilityId, String message, Throwable cause) {
        super("DISPATCH_ERROR", message, facilityId, cause);
    }

    /**
     * 큐 백엔드 사용 불가
     */
    public static DispatchException backendUnavailable(String facilityId, Throwable cause) {
        return new DispatchException(facilityId,
                "Crawl queue unavailable: " + DetectionException.describe(cause), cause);
    }

    /**
     * 스케줄러 종료 중
     */
    public static DispatchException shuttingDown(String facilityId) {
        return new DispatchException(facilityId, "Scheduler is shutting down; dispatch rejected");
    }
}
