package me.internalizable.proxyfleet.api.error;

import javax.annotation.Nullable;

/**
 * Thrown when another instance already claims the requested port.
 */
public class PortConflictException extends FleetException {

    private final int port;
    private final String owner;

    public PortConflictException(int port, @Nullable String owner) {
        super(ErrorKind.PORT_CONFLICT, owner != null
                ? "Port " + port + " is already used by instance '" + owner + "'"
                : "Port " + port + " is already in use");
        this.port = port;
        this.owner = owner;
    }

    public int getPort() {
        return port;
    }

    /**
     * Get the name of the instance holding the port.
     *
     * @return owning instance, or null if unknown
     */
    @Nullable
    public String getOwner() {
        return owner;
    }
}
