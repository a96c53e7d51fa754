package com.vidnyan.guard.application.port.out;

/**
 * The control plane answered, but the body is not a rule list at all.
 * Handled exactly like an unreachable control plane.
 */
public class MalformedRemoteSetException extends ControlPlaneUnreachableException {

    public MalformedRemoteSetException(String message) {
        super(message);
    }

    public MalformedRemoteSetException(String message, Throwable cause) {
        super(message, cause);
    }
}
