package me.internalizable.proxyfleet.api;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * API for managing forward-proxy and TLS-tunnel instances on one host.
 *
 * <p>Mutating operations run off the caller's thread and complete with a
 * definitive outcome. Failures complete the future exceptionally with a
 * {@link me.internalizable.proxyfleet.api.error.FleetException} subclass,
 * whose {@link me.internalizable.proxyfleet.api.error.ErrorKind} the caller
 * translates to its own status codes.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ProxyFleetAPI api = manager.getApi();
 *
 * api.createInstance(InstanceSpec.forwardProxy("office", 3128))
 *     .thenCompose(info -> api.startInstance(info.getName()))
 *     .thenCompose(info -> api.addUser("office", "alice", "secret1"))
 *     .join();
 *
 * // Switch the listener to TLS; the running daemon is restarted
 * api.updateInstance("office", InstanceUpdate.builder()
 *     .httpsEnabled(true)
 *     .certificate(CertificateParams.forCommonName("proxy.example.com"))
 *     .build()).join();
 * }</pre>
 */
public interface ProxyFleetAPI {

    // ==================== Lifecycle ====================

    /**
     * Create an instance and write its artifacts. The instance starts stopped.
     *
     * @param spec instance variant and fields
     * @return future completing with the stored instance
     */
    @Nonnull
    CompletableFuture<InstanceInfo> createInstance(@Nonnull InstanceSpec spec);

    /**
     * Record the intent to run and start the daemon. Idempotent.
     *
     * @param name instance name
     * @return future completing with the instance once its port is ready
     */
    @Nonnull
    CompletableFuture<InstanceInfo> startInstance(@Nonnull String name);

    /**
     * Record the intent to stop and stop the daemon. Idempotent.
     *
     * @param name instance name
     * @return future completing with the stopped instance
     */
    @Nonnull
    CompletableFuture<InstanceInfo> stopInstance(@Nonnull String name);

    /**
     * Stop then start the daemon without changing the desired state.
     *
     * @param name instance name
     * @return future completing with the instance
     */
    @Nonnull
    CompletableFuture<InstanceInfo> restartInstance(@Nonnull String name);

    /**
     * Apply a partial update, rewriting artifacts and restarting a running daemon.
     *
     * @param name instance name
     * @param update fields to change
     * @return future completing with the updated instance
     */
    @Nonnull
    CompletableFuture<InstanceInfo> updateInstance(@Nonnull String name, @Nonnull InstanceUpdate update);

    /**
     * Stop the daemon and remove every artifact of the instance.
     *
     * @param name instance name
     * @return future completing once nothing of the instance remains
     */
    @Nonnull
    CompletableFuture<Void> deleteInstance(@Nonnull String name);

    // ==================== Users ====================

    /**
     * Add a basic-auth user to a forward proxy.
     *
     * @param name instance name
     * @param username username
     * @param password plain-text password, hashed before it reaches disk
     * @return future completing when the credential file is written
     */
    @Nonnull
    CompletableFuture<Void> addUser(@Nonnull String name, @Nonnull String username, @Nonnull String password);

    /**
     * Remove a basic-auth user from a forward proxy.
     *
     * @param name instance name
     * @param username username
     * @return future completing when the credential file is written
     */
    @Nonnull
    CompletableFuture<Void> removeUser(@Nonnull String name, @Nonnull String username);

    /**
     * List usernames of a forward proxy. Hashes are never returned.
     *
     * @param name instance name
     * @return sorted usernames
     */
    @Nonnull
    List<String> getUsers(@Nonnull String name);

    // ==================== Certificates ====================

    /**
     * Replace the instance's certificate and restart a running daemon.
     *
     * @param name instance name
     * @param params new parameters, or null to reuse the stored ones
     * @return future completing with the new certificate's details
     */
    @Nonnull
    CompletableFuture<CertificateDetails> regenerateCertificate(@Nonnull String name,
                                                                @Nullable CertificateParams params);

    /**
     * Read the instance's certificate.
     *
     * @param name instance name
     * @return certificate details, or null if the instance has none
     */
    @Nullable
    CertificateDetails getCertificate(@Nonnull String name);

    // ==================== Queries ====================

    /**
     * Get information about an instance.
     *
     * @param name instance name
     * @return instance info, or null if not found
     */
    @Nullable
    InstanceInfo getInstance(@Nonnull String name);

    /**
     * Get all instances, sorted by name.
     *
     * @return instance infos
     */
    @Nonnull
    Collection<InstanceInfo> getAllInstances();

    /**
     * Get the last lines written by the instance's daemon.
     *
     * @param name instance name
     * @param lines maximum number of lines
     * @return log lines, oldest first
     */
    @Nonnull
    List<String> getRecentLogs(@Nonnull String name, int lines);

    /**
     * Get fleet statistics.
     *
     * @return statistics
     */
    @Nonnull
    FleetStats getStats();

    /**
     * Instance information.
     */
    interface InstanceInfo {
        @Nonnull
        String getName();

        @Nonnull
        ProxyType getType();

        int getPort();

        boolean isHttpsEnabled();

        boolean isDpiEvasionEnabled();

        /**
         * Get the upstream address (TLS tunnels only).
         */
        @Nullable
        String getForwardAddress();

        /**
         * Get the cover domain (TLS tunnels only).
         */
        @Nullable
        String getCoverDomain();

        /**
         * Get the loopback port of the cover site, if the tunnel has one.
         */
        @Nullable
        Integer getCoverPort();

        @Nonnull
        DesiredState getDesiredState();

        @Nonnull
        InstanceStatus getStatus();

        /**
         * Get the reason recorded with an error status.
         */
        @Nullable
        String getStatusReason();

        @Nonnull
        Instant getCreatedAt();

        @Nonnull
        Instant getUpdatedAt();

        /**
         * Get the daemon's PID, or -1 if no process is tracked.
         */
        long getPid();

        /**
         * Get the daemon uptime in milliseconds, or 0 if not running.
         */
        long getUptimeMillis();
    }

    /**
     * Fleet statistics.
     */
    interface FleetStats {
        int getTotalInstances();
        int getForwardProxies();
        int getTlsTunnels();
        int getRunningInstances();
        int getStoppedInstances();
        int getFailedInstances();
        int getTotalUsers();
    }
}
