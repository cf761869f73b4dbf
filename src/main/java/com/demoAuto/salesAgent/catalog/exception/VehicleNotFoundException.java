package com.demoAuto.salesAgent.catalog.exception;

/**
 * Exception thrown when a stock id does not resolve to a catalog record.
 */
public class VehicleNotFoundException extends RuntimeException {

    public VehicleNotFoundException(String stockId) {
        super("Vehicle not found: " + stockId);
    }
}
