package me.internalizable.proxyfleet.api.error;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Base exception for every failure reported by the fleet manager.
 */
public class FleetException extends RuntimeException {

    private final ErrorKind kind;

    public FleetException(@Nonnull ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FleetException(@Nonnull ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /**
     * Get the failure category.
     *
     * @return error kind
     */
    @Nonnull
    public ErrorKind getKind() {
        return kind;
    }
}
