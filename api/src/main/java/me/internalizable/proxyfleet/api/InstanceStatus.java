package me.internalizable.proxyfleet.api;

import javax.annotation.Nonnull;

/**
 * Last observed state of the process backing an instance.
 */
public enum InstanceStatus {

    /**
     * Record committed, artifacts still being written.
     */
    INITIALIZING("initializing"),

    /**
     * Daemon process is alive and its port accepted a connection.
     */
    RUNNING("running"),

    /**
     * No daemon process is running.
     */
    STOPPED("stopped"),

    /**
     * Last operation or the daemon itself failed; see the status reason.
     */
    ERROR("error");

    private final String wireName;

    InstanceStatus(String wireName) {
        this.wireName = wireName;
    }

    @Nonnull
    public String getWireName() {
        return wireName;
    }

    @Nonnull
    public static InstanceStatus fromWireName(@Nonnull String value) {
        for (InstanceStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown instance status: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
