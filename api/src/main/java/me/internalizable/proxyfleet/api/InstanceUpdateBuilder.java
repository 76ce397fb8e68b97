package me.internalizable.proxyfleet.api;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Builder implementation for instance updates.
 */
public class InstanceUpdateBuilder implements InstanceUpdate.Builder {

    private Integer port;
    private Boolean httpsEnabled;
    private Boolean dpiEvasionEnabled;
    private String forwardAddress;
    private String coverDomain;
    private boolean clearCoverDomain;
    private CertificateParams certificate;

    @Override
    public InstanceUpdate.Builder port(int port) {
        this.port = port;
        return this;
    }

    @Override
    public InstanceUpdate.Builder httpsEnabled(boolean enabled) {
        this.httpsEnabled = enabled;
        return this;
    }

    @Override
    public InstanceUpdate.Builder dpiEvasionEnabled(boolean enabled) {
        this.dpiEvasionEnabled = enabled;
        return this;
    }

    @Override
    public InstanceUpdate.Builder forwardAddress(@Nonnull String forwardAddress) {
        this.forwardAddress = Objects.requireNonNull(forwardAddress, "forwardAddress");
        return this;
    }

    @Override
    public InstanceUpdate.Builder coverDomain(@Nonnull String coverDomain) {
        this.coverDomain = Objects.requireNonNull(coverDomain, "coverDomain");
        this.clearCoverDomain = false;
        return this;
    }

    @Override
    public InstanceUpdate.Builder clearCoverDomain() {
        this.coverDomain = null;
        this.clearCoverDomain = true;
        return this;
    }

    @Override
    public InstanceUpdate.Builder certificate(@Nonnull CertificateParams params) {
        this.certificate = Objects.requireNonNull(params, "params");
        return this;
    }

    @Override
    public InstanceUpdate build() {
        return new InstanceUpdateImpl(port, httpsEnabled, dpiEvasionEnabled,
                forwardAddress, coverDomain, clearCoverDomain, certificate);
    }

    private record InstanceUpdateImpl(
            Integer port,
            Boolean httpsEnabled,
            Boolean dpiEvasionEnabled,
            String forwardAddress,
            String coverDomain,
            boolean clearCoverDomain,
            CertificateParams certificate
    ) implements InstanceUpdate {

        @Override
        @Nullable
        public Integer getPort() {
            return port;
        }

        @Override
        @Nullable
        public Boolean getHttpsEnabled() {
            return httpsEnabled;
        }

        @Override
        @Nullable
        public Boolean getDpiEvasionEnabled() {
            return dpiEvasionEnabled;
        }

        @Override
        @Nullable
        public String getForwardAddress() {
            return forwardAddress;
        }

        @Override
        @Nullable
        public String getCoverDomain() {
            return coverDomain;
        }

        @Override
        public boolean isClearCoverDomain() {
            return clearCoverDomain;
        }

        @Override
        @Nullable
        public CertificateParams getCertificate() {
            return certificate;
        }
    }
}
