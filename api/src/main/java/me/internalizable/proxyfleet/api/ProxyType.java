package me.internalizable.proxyfleet.api;

import javax.annotation.Nonnull;

/**
 * Kind of daemon backing an instance.
 */
public enum ProxyType {

    /**
     * Forward HTTP(S) proxy relaying client requests to arbitrary destinations.
     */
    FORWARD_PROXY("forward_proxy"),

    /**
     * TLS front that routes connections by SNI to an upstream or a cover site.
     */
    TLS_TUNNEL("tls_tunnel");

    private final String wireName;

    ProxyType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Get the lowercase name used in persisted records.
     *
     * @return wire name
     */
    @Nonnull
    public String getWireName() {
        return wireName;
    }

    /**
     * Parse a wire name or enum constant name, case-insensitively.
     *
     * @param value the text
     * @return the proxy type
     * @throws IllegalArgumentException if the value names no type
     */
    @Nonnull
    public static ProxyType fromWireName(@Nonnull String value) {
        for (ProxyType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown proxy type: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
