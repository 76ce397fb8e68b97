package me.internalizable.proxyfleet.api.error;

/**
 * Thrown when another instance already uses the requested name.
 */
public class NameConflictException extends FleetException {

    public NameConflictException(String message) {
        super(ErrorKind.NAME_CONFLICT, message);
    }

    public NameConflictException(String message, Throwable cause) {
        super(ErrorKind.NAME_CONFLICT, message, cause);
    }
}
