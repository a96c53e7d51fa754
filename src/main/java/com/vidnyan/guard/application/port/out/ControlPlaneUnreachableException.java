package com.vidnyan.guard.application.port.out;

/**
 * The control plane could not be reached, answered with a non-success status,
 * or did not answer within the fetch timeout.
 */
public class ControlPlaneUnreachableException extends Exception {

    public ControlPlaneUnreachableException(String message) {
        super(message);
    }

    public ControlPlaneUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
