package me.internalizable.proxyfleet.api.error;

/**
 * Thrown when a daemon cannot be spawned, exits early, fails to bind or never becomes ready.
 */
public class ProcessException extends FleetException {

    public ProcessException(String message) {
        super(ErrorKind.PROCESS, message);
    }

    public ProcessException(String message, Throwable cause) {
        super(ErrorKind.PROCESS, message, cause);
    }
}
