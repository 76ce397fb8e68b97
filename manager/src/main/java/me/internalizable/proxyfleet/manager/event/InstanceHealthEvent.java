package me.internalizable.proxyfleet.manager.event;

import me.internalizable.proxyfleet.api.InstanceStatus;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Event fired when the observed status of an instance changes outside an
 * explicit request, such as a daemon exiting on its own.
 */
public class InstanceHealthEvent {

    private final String instanceName;
    private final InstanceStatus previousStatus;
    private final InstanceStatus newStatus;
    private final String message;

    /**
     * Create an instance health event.
     *
     * @param instanceName instance name
     * @param previousStatus previous status
     * @param newStatus new status
     * @param message optional message
     */
    public InstanceHealthEvent(
            @Nonnull String instanceName,
            @Nonnull InstanceStatus previousStatus,
            @Nonnull InstanceStatus newStatus,
            @Nullable String message) {
        this.instanceName = Objects.requireNonNull(instanceName, "instanceName");
        this.previousStatus = Objects.requireNonNull(previousStatus, "previousStatus");
        this.newStatus = Objects.requireNonNull(newStatus, "newStatus");
        this.message = message;
    }

    @Nonnull
    public String getInstanceName() {
        return instanceName;
    }

    @Nonnull
    public InstanceStatus getPreviousStatus() {
        return previousStatus;
    }

    @Nonnull
    public InstanceStatus getNewStatus() {
        return newStatus;
    }

    /**
     * Get the status change message.
     *
     * @return message, or null
     */
    @Nullable
    public String getMessage() {
        return message;
    }

    /**
     * Check if the instance became unhealthy.
     *
     * @return true if now in error
     */
    public boolean becameUnhealthy() {
        return newStatus == InstanceStatus.ERROR && previousStatus != InstanceStatus.ERROR;
    }

    @Override
    public String toString() {
        return "InstanceHealthEvent{" + instanceName + ": " + previousStatus + " -> " + newStatus
                + (message != null ? " (" + message + ")" : "") + '}';
    }
}
