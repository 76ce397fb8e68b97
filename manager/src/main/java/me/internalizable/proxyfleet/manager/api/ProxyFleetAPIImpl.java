package me.internalizable.proxyfleet.manager.api;

import me.internalizable.proxyfleet.api.CertificateDetails;
import me.internalizable.proxyfleet.api.CertificateParams;
import me.internalizable.proxyfleet.api.DesiredState;
import me.internalizable.proxyfleet.api.InstanceSpec;
import me.internalizable.proxyfleet.api.InstanceStatus;
import me.internalizable.proxyfleet.api.InstanceUpdate;
import me.internalizable.proxyfleet.api.ProxyFleetAPI;
import me.internalizable.proxyfleet.api.ProxyType;
import me.internalizable.proxyfleet.manager.FleetManager;
import me.internalizable.proxyfleet.manager.process.ManagedProcess;
import me.internalizable.proxyfleet.manager.registry.InstanceRecord;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Implementation of the ProxyFleetAPI for embedding callers.
 */
public class ProxyFleetAPIImpl implements ProxyFleetAPI {

    private final FleetManager fleetManager;

    public ProxyFleetAPIImpl(@Nonnull FleetManager fleetManager) {
        this.fleetManager = Objects.requireNonNull(fleetManager, "fleetManager");
    }

    @Override
    @Nonnull
    public CompletableFuture<InstanceInfo> createInstance(@Nonnull InstanceSpec spec) {
        Objects.requireNonNull(spec, "spec");
        return fleetManager.createInstance(spec).thenApply(this::toInstanceInfo);
    }

    @Override
    @Nonnull
    public CompletableFuture<InstanceInfo> startInstance(@Nonnull String name) {
        Objects.requireNonNull(name, "name");
        return fleetManager.startInstance(name).thenApply(this::toInstanceInfo);
    }

    @Override
    @Nonnull
    public CompletableFuture<InstanceInfo> stopInstance(@Nonnull String name) {
        Objects.requireNonNull(name, "name");
        return fleetManager.stopInstance(name).thenApply(this::toInstanceInfo);
    }

    @Override
    @Nonnull
    public CompletableFuture<InstanceInfo> restartInstance(@Nonnull String name) {
        Objects.requireNonNull(name, "name");
        return fleetManager.restartInstance(name).thenApply(this::toInstanceInfo);
    }

    @Override
    @Nonnull
    public CompletableFuture<InstanceInfo> updateInstance(@Nonnull String name, @Nonnull InstanceUpdate update) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(update, "update");
        return fleetManager.updateInstance(name, update).thenApply(this::toInstanceInfo);
    }

    @Override
    @Nonnull
    public CompletableFuture<Void> deleteInstance(@Nonnull String name) {
        Objects.requireNonNull(name, "name");
        return fleetManager.deleteInstance(name);
    }

    @Override
    @Nonnull
    public CompletableFuture<Void> addUser(@Nonnull String name, @Nonnull String username, @Nonnull String password) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        return fleetManager.addUser(name, username, password);
    }

    @Override
    @Nonnull
    public CompletableFuture<Void> removeUser(@Nonnull String name, @Nonnull String username) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(username, "username");
        return fleetManager.removeUser(name, username);
    }

    @Override
    @Nonnull
    public List<String> getUsers(@Nonnull String name) {
        Objects.requireNonNull(name, "name");
        return fleetManager.listUsers(name);
    }

    @Override
    @Nonnull
    public CompletableFuture<CertificateDetails> regenerateCertificate(@Nonnull String name,
                                                                       @Nullable CertificateParams params) {
        Objects.requireNonNull(name, "name");
        return fleetManager.regenerateCertificate(name, params);
    }

    @Override
    @Nullable
    public CertificateDetails getCertificate(@Nonnull String name) {
        Objects.requireNonNull(name, "name");
        return fleetManager.getCertificate(name);
    }

    @Override
    @Nullable
    public InstanceInfo getInstance(@Nonnull String name) {
        Objects.requireNonNull(name, "name");
        InstanceRecord record = fleetManager.getInstance(name);
        return record != null ? toInstanceInfo(record) : null;
    }

    @Override
    @Nonnull
    public Collection<InstanceInfo> getAllInstances() {
        return fleetManager.listInstances().stream()
                .map(this::toInstanceInfo)
                .collect(Collectors.toList());
    }

    @Override
    @Nonnull
    public List<String> getRecentLogs(@Nonnull String name, int lines) {
        Objects.requireNonNull(name, "name");
        return fleetManager.getRecentLogs(name, lines);
    }

    @Override
    @Nonnull
    public FleetStats getStats() {
        FleetManager.Stats stats = fleetManager.getStats();
        return new FleetStatsImpl(
                stats.totalInstances(),
                stats.forwardProxies(),
                stats.tlsTunnels(),
                stats.runningInstances(),
                stats.stoppedInstances(),
                stats.failedInstances(),
                stats.totalUsers()
        );
    }

    private InstanceInfo toInstanceInfo(InstanceRecord record) {
        ManagedProcess process = fleetManager.getSupervisor().getProcess(record.name());
        boolean alive = process != null && process.isAlive();
        return new InstanceInfoImpl(
                record.name(),
                record.proxyType(),
                record.port(),
                record.httpsEnabled(),
                record.dpiEvasionEnabled(),
                record.forwardAddress(),
                record.coverDomain(),
                record.coverPort(),
                record.desiredState(),
                record.status(),
                record.statusReason(),
                record.createdAt(),
                record.updatedAt() != null ? record.updatedAt() : record.createdAt(),
                alive ? process.getPid() : -1,
                alive ? process.getUptime() : 0
        );
    }

    // ==================== Implementation Classes ====================

    private record InstanceInfoImpl(
            String name,
            ProxyType type,
            int port,
            boolean httpsEnabled,
            boolean dpiEvasionEnabled,
            String forwardAddress,
            String coverDomain,
            Integer coverPort,
            DesiredState desiredState,
            InstanceStatus status,
            String statusReason,
            Instant createdAt,
            Instant updatedAt,
            long pid,
            long uptimeMillis
    ) implements InstanceInfo {
        @Override
        @Nonnull
        public String getName() {
            return name;
        }

        @Override
        @Nonnull
        public ProxyType getType() {
            return type;
        }

        @Override
        public int getPort() {
            return port;
        }

        @Override
        public boolean isHttpsEnabled() {
            return httpsEnabled;
        }

        @Override
        public boolean isDpiEvasionEnabled() {
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
        @Nullable
        public Integer getCoverPort() {
            return coverPort;
        }

        @Override
        @Nonnull
        public DesiredState getDesiredState() {
            return desiredState;
        }

        @Override
        @Nonnull
        public InstanceStatus getStatus() {
            return status;
        }

        @Override
        @Nullable
        public String getStatusReason() {
            return statusReason;
        }

        @Override
        @Nonnull
        public Instant getCreatedAt() {
            return createdAt;
        }

        @Override
        @Nonnull
        public Instant getUpdatedAt() {
            return updatedAt;
        }

        @Override
        public long getPid() {
            return pid;
        }

        @Override
        public long getUptimeMillis() {
            return uptimeMillis;
        }
    }

    private record FleetStatsImpl(
            int totalInstances,
            int forwardProxies,
            int tlsTunnels,
            int runningInstances,
            int stoppedInstances,
            int failedInstances,
            int totalUsers
    ) implements FleetStats {
        @Override
        public int getTotalInstances() {
            return totalInstances;
        }

        @Override
        public int getForwardProxies() {
            return forwardProxies;
        }

        @Override
        public int getTlsTunnels() {
            return tlsTunnels;
        }

        @Override
        public int getRunningInstances() {
            return runningInstances;
        }

        @Override
        public int getStoppedInstances() {
            return stoppedInstances;
        }

        @Override
        public int getFailedInstances() {
            return failedInstances;
        }

        @Override
        public int getTotalUsers() {
            return totalUsers;
        }
    }
}
