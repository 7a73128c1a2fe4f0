package org.tarik.autoheal.exceptions;

/**
 * Infrastructure fault of an external service, as opposed to a failure of the automation script itself.
 */
public class ServiceException extends RuntimeException {
    private final ServiceKind serviceKind;

    public ServiceException(String message, ServiceKind serviceKind) {
        super(message);
        this.serviceKind = serviceKind;
    }

    public ServiceException(String message, ServiceKind serviceKind, Throwable cause) {
        super(message, cause);
        this.serviceKind = serviceKind;
    }

    public ServiceKind getServiceKind() {
        return serviceKind;
    }

    public enum ServiceKind {
        SYNTHESIS,
        EXECUTION
    }
}
