package me.internalizable.proxyfleet.api;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Partial update of an instance. Null fields are left unchanged.
 *
 * <p>Fields that do not apply to the instance's {@link ProxyType} are
 * rejected by the manager rather than ignored.</p>
 */
public interface InstanceUpdate {

    @Nullable
    Integer getPort();

    /**
     * Forward proxy only.
     */
    @Nullable
    Boolean getHttpsEnabled();

    /**
     * Forward proxy only.
     */
    @Nullable
    Boolean getDpiEvasionEnabled();

    /**
     * TLS tunnel only.
     */
    @Nullable
    String getForwardAddress();

    /**
     * TLS tunnel only.
     */
    @Nullable
    String getCoverDomain();

    /**
     * Whether the cover domain should be removed. TLS tunnel only.
     */
    boolean isClearCoverDomain();

    /**
     * New certificate parameters; triggers regeneration when the instance
     * serves TLS.
     */
    @Nullable
    CertificateParams getCertificate();

    /**
     * Check whether the update changes nothing.
     *
     * @return true if every field is unset
     */
    default boolean isEmpty() {
        return getPort() == null && getHttpsEnabled() == null && getDpiEvasionEnabled() == null
                && getForwardAddress() == null && getCoverDomain() == null
                && !isClearCoverDomain() && getCertificate() == null;
    }

    /**
     * Create a builder for an update.
     */
    @Nonnull
    static Builder builder() {
        return new InstanceUpdateBuilder();
    }

    /**
     * Builder for partial updates.
     */
    interface Builder {
        Builder port(int port);
        Builder httpsEnabled(boolean enabled);
        Builder dpiEvasionEnabled(boolean enabled);
        Builder forwardAddress(@Nonnull String forwardAddress);
        Builder coverDomain(@Nonnull String coverDomain);
        Builder clearCoverDomain();
        Builder certificate(@Nonnull CertificateParams params);
        InstanceUpdate build();
    }
}
