package me.internalizable.proxyfleet.manager.reconcile;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Step the reconciler decided on for one instance.
 *
 * @param type what to do
 * @param name instance name
 * @param reason why, for logging
 */
public record ReconcileAction(@Nonnull Type type, @Nonnull String name, @Nonnull String reason) {

    public ReconcileAction {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(reason, "reason");
    }

    public enum Type {
        /**
         * Desired running, no live process: start the daemon.
         */
        START,
        /**
         * Desired stopped, but the record still claims a live daemon from a previous run.
         */
        MARK_STOPPED,
        /**
         * Nothing to do.
         */
        NONE
    }
}
