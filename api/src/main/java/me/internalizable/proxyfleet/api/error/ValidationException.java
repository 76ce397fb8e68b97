package me.internalizable.proxyfleet.api.error;

/**
 * Thrown when a name, port or instance field is malformed.
 */
public class ValidationException extends FleetException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
