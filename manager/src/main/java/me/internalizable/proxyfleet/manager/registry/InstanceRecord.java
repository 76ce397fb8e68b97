package me.internalizable.proxyfleet.manager.registry;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import me.internalizable.proxyfleet.api.CertificateParams;
import me.internalizable.proxyfleet.api.DesiredState;
import me.internalizable.proxyfleet.api.InstanceStatus;
import me.internalizable.proxyfleet.api.ProxyType;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Objects;

/**
 * Persisted metadata of one instance, stored as {@code instance.json} in the
 * instance directory.
 *
 * <p>Records are immutable; every change produces a new record that the
 * registry writes back atomically. Fields that do not apply to the record's
 * {@link ProxyType} are kept at their neutral values (false or null).</p>
 *
 * <p>Records written before desired states were tracked have no
 * {@code desired_state}; they load as {@link DesiredState#RUNNING}.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InstanceRecord(
        @Nonnull String name,
        @Nonnull ProxyType proxyType,
        int port,
        boolean httpsEnabled,
        @JsonAlias("dpi_prevention") boolean dpiEvasionEnabled,
        @Nullable String forwardAddress,
        @Nullable String coverDomain,
        @Nullable Integer coverPort,
        @Nullable CertificateParams certificate,
        @Nonnull DesiredState desiredState,
        @Nonnull InstanceStatus status,
        @Nullable String statusReason,
        @Nonnull Instant createdAt,
        @Nullable Instant updatedAt
) {

    public InstanceRecord {
        Objects.requireNonNull(name, "name");
        if (proxyType == null) {
            proxyType = ProxyType.FORWARD_PROXY;
        }
        if (desiredState == null) {
            desiredState = DesiredState.RUNNING;
        }
        if (status == null) {
            status = InstanceStatus.STOPPED;
        }
        if (createdAt == null) {
            createdAt = Instant.EPOCH;
        }
        if (coverDomain != null && coverDomain.isEmpty()) {
            coverDomain = null;
        }
    }

    /**
     * Check whether the daemon needs a certificate: a forward proxy serving
     * https, or a tunnel with a cover site.
     *
     * @return true if a certificate must exist
     */
    public boolean usesCertificate() {
        return proxyType == ProxyType.FORWARD_PROXY ? httpsEnabled : hasCoverSite();
    }

    /**
     * Check whether this is a tunnel fronted by a cover site.
     *
     * @return true if a cover route is configured
     */
    public boolean hasCoverSite() {
        return proxyType == ProxyType.TLS_TUNNEL && coverDomain != null && coverPort != null;
    }

    @Nonnull
    public InstanceRecord withPort(int port, @Nullable Integer coverPort) {
        return new InstanceRecord(name, proxyType, port, httpsEnabled, dpiEvasionEnabled, forwardAddress,
                coverDomain, coverPort, certificate, desiredState, status, statusReason, createdAt, Instant.now());
    }

    @Nonnull
    public InstanceRecord withHttpsEnabled(boolean httpsEnabled) {
        return new InstanceRecord(name, proxyType, port, httpsEnabled, dpiEvasionEnabled, forwardAddress,
                coverDomain, coverPort, certificate, desiredState, status, statusReason, createdAt, Instant.now());
    }

    @Nonnull
    public InstanceRecord withDpiEvasionEnabled(boolean dpiEvasionEnabled) {
        return new InstanceRecord(name, proxyType, port, httpsEnabled, dpiEvasionEnabled, forwardAddress,
                coverDomain, coverPort, certificate, desiredState, status, statusReason, createdAt, Instant.now());
    }

    @Nonnull
    public InstanceRecord withForwardAddress(@Nullable String forwardAddress) {
        return new InstanceRecord(name, proxyType, port, httpsEnabled, dpiEvasionEnabled, forwardAddress,
                coverDomain, coverPort, certificate, desiredState, status, statusReason, createdAt, Instant.now());
    }

    @Nonnull
    public InstanceRecord withCoverDomain(@Nullable String coverDomain) {
        return new InstanceRecord(name, proxyType, port, httpsEnabled, dpiEvasionEnabled, forwardAddress,
                coverDomain, coverPort, certificate, desiredState, status, statusReason, createdAt, Instant.now());
    }

    @Nonnull
    public InstanceRecord withCertificate(@Nullable CertificateParams certificate) {
        return new InstanceRecord(name, proxyType, port, httpsEnabled, dpiEvasionEnabled, forwardAddress,
                coverDomain, coverPort, certificate, desiredState, status, statusReason, createdAt, Instant.now());
    }

    @Nonnull
    public InstanceRecord withDesiredState(@Nonnull DesiredState desiredState) {
        return new InstanceRecord(name, proxyType, port, httpsEnabled, dpiEvasionEnabled, forwardAddress,
                coverDomain, coverPort, certificate, desiredState, status, statusReason, createdAt, Instant.now());
    }

    /**
     * Copy with a new observed status. The reason is kept only for errors.
     *
     * @param status new status
     * @param reason failure reason, or null
     * @return updated record
     */
    @Nonnull
    public InstanceRecord withStatus(@Nonnull InstanceStatus status, @Nullable String reason) {
        String kept = status == InstanceStatus.ERROR ? reason : null;
        return new InstanceRecord(name, proxyType, port, httpsEnabled, dpiEvasionEnabled, forwardAddress,
                coverDomain, coverPort, certificate, desiredState, status, kept, createdAt, Instant.now());
    }
}
