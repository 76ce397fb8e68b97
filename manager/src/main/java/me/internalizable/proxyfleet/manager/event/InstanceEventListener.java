package me.internalizable.proxyfleet.manager.event;

import javax.annotation.Nonnull;

/**
 * Receives health events. Called from the supervisor's monitor thread, so
 * implementations must not block for long.
 */
@FunctionalInterface
public interface InstanceEventListener {

    void onHealthChange(@Nonnull InstanceHealthEvent event);
}
