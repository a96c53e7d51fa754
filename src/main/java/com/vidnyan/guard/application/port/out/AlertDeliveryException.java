package com.vidnyan.guard.application.port.out;

public class AlertDeliveryException extends Exception {

    private final String sinkName;

    public AlertDeliveryException(String sinkName, String message) {
        super(message);
        this.sinkName = sinkName;
    }

    public AlertDeliveryException(String sinkName, String message, Throwable cause) {
        super(message, cause);
        this.sinkName = sinkName;
    }

    public String getSinkName() {
        return sinkName;
    }
}
