package me.internalizable.proxyfleet.api.error;

/**
 * Category of a manager failure.
 *
 * <p>The management layer maps each kind to a response code; the manager
 * itself never retries on any of them.</p>
 */
public enum ErrorKind {

    /**
     * Malformed name, port or field. Never reaches disk.
     */
    VALIDATION,

    NAME_CONFLICT,

    PORT_CONFLICT,

    /**
     * Unknown instance or user.
     */
    NOT_FOUND,

    DUPLICATE_USER,

    /**
     * Spawn failure, non-zero exit, bind failure or readiness timeout.
     */
    PROCESS,

    CERTIFICATE,

    /**
     * Filesystem failure while writing or reading an artifact.
     */
    IO
}
