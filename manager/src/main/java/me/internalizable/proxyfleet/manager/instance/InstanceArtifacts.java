package me.internalizable.proxyfleet.manager.instance;

import me.internalizable.proxyfleet.api.CertificateParams;
import me.internalizable.proxyfleet.api.ProxyType;
import me.internalizable.proxyfleet.api.error.StorageException;
import me.internalizable.proxyfleet.manager.config.FleetConfig;
import me.internalizable.proxyfleet.manager.registry.AtomicFiles;
import me.internalizable.proxyfleet.manager.registry.InstanceLayout;
import me.internalizable.proxyfleet.manager.registry.InstanceRecord;
import me.internalizable.proxyfleet.manager.registry.InstanceRegistry;
import me.internalizable.proxyfleet.manager.security.ArtifactPermissions;
import me.internalizable.proxyfleet.manager.security.AuthStore;
import me.internalizable.proxyfleet.manager.security.CertificateManager;
import me.internalizable.proxyfleet.manager.template.ConfigGenerator;
import me.internalizable.proxyfleet.manager.template.CoverSite;
import me.internalizable.proxyfleet.manager.template.GeneratedConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.Objects;

/**
 * Writes everything a daemon needs from an instance record: directories,
 * credential file, certificate, cover site and configuration.
 *
 * <p>Called on create, on every configuration-affecting update and before
 * every start, so the files on disk always match the record the daemon is
 * launched with.</p>
 */
public class InstanceArtifacts {

    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceArtifacts.class);

    private final FleetConfig config;
    private final InstanceRegistry registry;
    private final ConfigGenerator configGenerator;
    private final CertificateManager certificateManager;
    private final AuthStore authStore;
    private final ArtifactPermissions permissions;

    public InstanceArtifacts(
            @Nonnull FleetConfig config,
            @Nonnull InstanceRegistry registry,
            @Nonnull ConfigGenerator configGenerator,
            @Nonnull CertificateManager certificateManager,
            @Nonnull AuthStore authStore,
            @Nonnull ArtifactPermissions permissions) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.configGenerator = Objects.requireNonNull(configGenerator, "configGenerator");
        this.certificateManager = Objects.requireNonNull(certificateManager, "certificateManager");
        this.authStore = Objects.requireNonNull(authStore, "authStore");
        this.permissions = Objects.requireNonNull(permissions, "permissions");
    }

    /**
     * Bring the instance's files in line with its record, keeping an existing certificate.
     *
     * @param record instance record
     * @return the written configuration
     */
    @Nonnull
    public GeneratedConfig prepare(@Nonnull InstanceRecord record) {
        return materialize(record, false);
    }

    /**
     * Bring the instance's files in line with its record.
     *
     * @param record instance record
     * @param regenerateCertificate replace the certificate even if one exists
     * @return the written configuration
     * @throws StorageException if a file cannot be written
     * @throws me.internalizable.proxyfleet.api.error.CertificateFailureException if certificate generation fails
     */
    @Nonnull
    public GeneratedConfig materialize(@Nonnull InstanceRecord record, boolean regenerateCertificate) {
        Objects.requireNonNull(record, "record");
        InstanceLayout layout = registry.layout(record.name());

        try {
            permissions.createDirectories(layout.getDirectory());
            permissions.createDirectories(layout.getLogsDirectory());

            if (record.proxyType() == ProxyType.FORWARD_PROXY) {
                authStore.ensureFile(layout);
            }

            if (record.usesCertificate() && (regenerateCertificate || !certificateManager.exists(layout))) {
                certificateManager.generate(layout, resolveCertificateParams(record));
            }

            if (record.hasCoverSite()) {
                CoverSite.ensureIndex(layout.getCoverSiteDirectory(), permissions);
            }

            GeneratedConfig generated = configGenerator.generate(record, layout);
            AtomicFiles.write(layout.getConfigFile(record.proxyType()), generated.toBytes(),
                    ArtifactPermissions.FILE);
            permissions.applyFile(layout.getConfigFile(record.proxyType()));

            LOGGER.debug("Wrote artifacts of '{}' to {}", record.name(), layout.getDirectory());
            return generated;
        } catch (IOException e) {
            throw new StorageException("Failed to write artifacts of '" + record.name() + "': "
                    + e.getMessage(), e);
        }
    }

    /**
     * Resolve the certificate parameters of an instance, filling in the
     * common name when the record leaves it open: the cover domain for
     * tunnels, the configured default otherwise.
     *
     * @param record instance record
     * @return parameters with a common name
     */
    @Nonnull
    public CertificateParams resolveCertificateParams(@Nonnull InstanceRecord record) {
        CertificateParams params = record.certificate() != null
                ? record.certificate()
                : config.defaultCertificateParams(null);
        if (params.commonName() != null) {
            return params;
        }
        String commonName = record.coverDomain() != null
                ? record.coverDomain()
                : config.getCertificates().getDefaultCommonName();
        return params.withCommonName(commonName);
    }
}
