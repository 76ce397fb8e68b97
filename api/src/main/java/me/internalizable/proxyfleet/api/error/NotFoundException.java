package me.internalizable.proxyfleet.api.error;

/**
 * Thrown when an instance or user does not exist.
 */
public class NotFoundException extends FleetException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}
