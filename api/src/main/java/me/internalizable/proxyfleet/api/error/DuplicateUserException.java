package me.internalizable.proxyfleet.api.error;

/**
 * Thrown when a username is already present in an instance's credential file.
 */
public class DuplicateUserException extends FleetException {

    public DuplicateUserException(String message) {
        super(ErrorKind.DUPLICATE_USER, message);
    }

    public DuplicateUserException(String message, Throwable cause) {
        super(ErrorKind.DUPLICATE_USER, message, cause);
    }
}
