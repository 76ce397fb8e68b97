package me.internalizable.proxyfleet.api;

import javax.annotation.Nonnull;

/**
 * Operator intent for an instance, independent of what the OS currently runs.
 */
public enum DesiredState {

    RUNNING("running"),

    STOPPED("stopped");

    private final String wireName;

    DesiredState(String wireName) {
        this.wireName = wireName;
    }

    @Nonnull
    public String getWireName() {
        return wireName;
    }

    @Nonnull
    public static DesiredState fromWireName(@Nonnull String value) {
        for (DesiredState state : values()) {
            if (state.wireName.equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown desired state: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
