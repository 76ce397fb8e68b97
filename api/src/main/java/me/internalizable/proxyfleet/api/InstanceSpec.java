package me.internalizable.proxyfleet.api;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Creation request for an instance, one variant per {@link ProxyType}.
 *
 * <p>Each variant carries only the fields that make sense for its daemon, so
 * a forward proxy can never be given a forward address and a tunnel can never
 * be given an https flag.</p>
 */
public interface InstanceSpec {

    /**
     * Get the instance name.
     */
    @Nonnull
    String name();

    /**
     * Get the listening port.
     */
    int port();

    /**
     * Get the variant's proxy type.
     */
    @Nonnull
    ProxyType type();

    /**
     * Get explicit certificate parameters.
     *
     * @return parameters, or null for defaults
     */
    @Nullable
    CertificateParams certificate();

    /**
     * Forward proxy without https or DPI evasion.
     */
    @Nonnull
    static ForwardProxy forwardProxy(@Nonnull String name, int port) {
        return new ForwardProxy(name, port, false, false, null);
    }

    /**
     * TLS tunnel to {@code forwardAddress}, optionally fronted by a cover domain.
     */
    @Nonnull
    static TlsTunnel tlsTunnel(@Nonnull String name, int port,
                               @Nonnull String forwardAddress, @Nullable String coverDomain) {
        return new TlsTunnel(name, port, forwardAddress, coverDomain, null);
    }

    /**
     * Forward proxy variant.
     *
     * @param name instance name
     * @param port listening port
     * @param httpsEnabled terminate TLS from clients on the listening port
     * @param dpiEvasionEnabled strip identifying headers and hide version banners
     * @param certificate certificate parameters used when https is enabled
     */
    record ForwardProxy(
            @Nonnull String name,
            int port,
            boolean httpsEnabled,
            boolean dpiEvasionEnabled,
            @Nullable CertificateParams certificate
    ) implements InstanceSpec {

        public ForwardProxy {
            Objects.requireNonNull(name, "name");
        }

        @Override
        @Nonnull
        public ProxyType type() {
            return ProxyType.FORWARD_PROXY;
        }

        @Nonnull
        public ForwardProxy withHttps(boolean enabled) {
            return new ForwardProxy(name, port, enabled, dpiEvasionEnabled, certificate);
        }

        @Nonnull
        public ForwardProxy withDpiEvasion(boolean enabled) {
            return new ForwardProxy(name, port, httpsEnabled, enabled, certificate);
        }

        @Nonnull
        public ForwardProxy withCertificate(@Nullable CertificateParams params) {
            return new ForwardProxy(name, port, httpsEnabled, dpiEvasionEnabled, params);
        }
    }

    /**
     * TLS tunnel variant.
     *
     * @param name instance name
     * @param port listening port
     * @param forwardAddress upstream {@code host:port} for the default route
     * @param coverDomain SNI name routed to the local cover site, or null for none
     * @param certificate parameters for the cover site certificate
     */
    record TlsTunnel(
            @Nonnull String name,
            int port,
            String forwardAddress,
            @Nullable String coverDomain,
            @Nullable CertificateParams certificate
    ) implements InstanceSpec {

        public TlsTunnel {
            Objects.requireNonNull(name, "name");
        }

        @Override
        @Nonnull
        public ProxyType type() {
            return ProxyType.TLS_TUNNEL;
        }

        @Nonnull
        public TlsTunnel withCertificate(@Nullable CertificateParams params) {
            return new TlsTunnel(name, port, forwardAddress, coverDomain, params);
        }
    }
}
