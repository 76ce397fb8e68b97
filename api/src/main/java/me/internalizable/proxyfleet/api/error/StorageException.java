package me.internalizable.proxyfleet.api.error;

/**
 * Thrown when an artifact or record cannot be written or read.
 */
public class StorageException extends FleetException {

    public StorageException(String message) {
        super(ErrorKind.IO, message);
    }

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.IO, message, cause);
    }
}
