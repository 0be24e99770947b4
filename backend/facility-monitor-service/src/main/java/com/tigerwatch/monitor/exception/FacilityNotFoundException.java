package com.tigerwatch.monitor.exception;

public class FacilityNotFoundException extends MonitorException {

    public FacilityNotFoundException(String facilityId) {
        super("FACILITY_NOT_FOUND", "Facility not found: " + facilityId, facilityId);
    }
}
