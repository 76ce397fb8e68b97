package me.internalizable.proxyfleet.manager;

import me.internalizable.proxyfleet.api.CertificateDetails;
import me.internalizable.proxyfleet.api.CertificateParams;
import me.internalizable.proxyfleet.api.DesiredState;
import me.internalizable.proxyfleet.api.InstanceSpec;
import me.internalizable.proxyfleet.api.InstanceStatus;
import me.internalizable.proxyfleet.api.InstanceUpdate;
import me.internalizable.proxyfleet.api.ProxyFleetAPI;
import me.internalizable.proxyfleet.api.ProxyType;
import me.internalizable.proxyfleet.api.error.ValidationException;
import me.internalizable.proxyfleet.manager.api.ProxyFleetAPIImpl;
import me.internalizable.proxyfleet.manager.config.FleetConfig;
import me.internalizable.proxyfleet.manager.event.InstanceEventListener;
import me.internalizable.proxyfleet.manager.event.InstanceHealthEvent;
import me.internalizable.proxyfleet.manager.instance.InstanceArtifacts;
import me.internalizable.proxyfleet.manager.instance.InstanceValidator;
import me.internalizable.proxyfleet.manager.process.InstanceLocks;
import me.internalizable.proxyfleet.manager.process.ProcessSupervisor;
import me.internalizable.proxyfleet.manager.reconcile.DesiredStateReconciler;
import me.internalizable.proxyfleet.manager.reconcile.ReconcileReport;
import me.internalizable.proxyfleet.manager.registry.InstanceLayout;
import me.internalizable.proxyfleet.manager.registry.InstanceRecord;
import me.internalizable.proxyfleet.manager.registry.InstanceRegistry;
import me.internalizable.proxyfleet.manager.registry.PortAllocator;
import me.internalizable.proxyfleet.manager.security.ArtifactPermissions;
import me.internalizable.proxyfleet.manager.security.AuthStore;
import me.internalizable.proxyfleet.manager.security.CertificateManager;
import me.internalizable.proxyfleet.manager.template.ConfigGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Instance lifecycle manager for a fleet of forward proxies and TLS tunnels
 * on one host.
 *
 * <p>Coordinates the instance registry, artifact generation, certificates,
 * credentials and process supervision. Every mutating operation runs on the
 * manager's worker pool while holding the instance's lock, so requests for
 * one instance serialize and requests for different instances proceed in
 * parallel.</p>
 *
 * <h2>Directory Structure</h2>
 * <pre>
 * &lt;dataDirectory&gt;/
 * ├── office/              # one directory per instance
 * │   ├── instance.json
 * │   ├── squid.conf
 * │   ├── passwd
 * │   └── logs/
 * └── vpn-front/
 *     ├── instance.json
 *     ├── nginx.conf
 *     ├── certs/
 *     ├── cover_site/
 *     └── logs/
 * </pre>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * FleetManager manager = new FleetManager(FleetConfig.load(Paths.get("manager.yml")));
 * manager.initialize();
 *
 * manager.createInstance(InstanceSpec.forwardProxy("office", 3128))
 *     .thenCompose(record -> manager.startInstance("office"))
 *     .join();
 *
 * manager.shutdown();
 * }</pre>
 */
public class FleetManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(FleetManager.class);

    private final FleetConfig config;
    private final List<InstanceEventListener> listeners = new CopyOnWriteArrayList<>();

    private InstanceRegistry registry;
    private InstanceLocks locks;
    private AuthStore authStore;
    private CertificateManager certificateManager;
    private InstanceArtifacts artifacts;
    private ProcessSupervisor supervisor;
    private ExecutorService asyncExecutor;
    private ProxyFleetAPI api;

    private volatile boolean initialized = false;
    private volatile boolean shutdown = false;

    /**
     * Create a fleet manager.
     *
     * @param config fleet configuration
     */
    public FleetManager(@Nonnull FleetConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    // ==================== Initialization ====================

    /**
     * Initialize the manager, start supervising and restore desired states.
     *
     * @throws IOException if the data directory cannot be prepared
     */
    public void initialize() throws IOException {
        initialize(true);
    }

    /**
     * Initialize the manager.
     *
     * @param supervise start the health monitor and reconcile desired states;
     *                  false for one-shot tools that must not spawn daemons
     * @throws IOException if the data directory cannot be prepared
     */
    public void initialize(boolean supervise) throws IOException {
        if (initialized) {
            throw new IllegalStateException("Fleet manager already initialized");
        }

        LOGGER.info("Initializing fleet manager...");

        ArtifactPermissions permissions = new ArtifactPermissions(config.getDaemonGroup());
        PortAllocator portAllocator = new PortAllocator(
                config.getPortAllocation().getRangeStart(), config.getPortAllocation().getRangeEnd());

        registry = new InstanceRegistry(config.resolveDataDirectory(), portAllocator, permissions);
        registry.initialize();

        locks = new InstanceLocks();
        authStore = new AuthStore(permissions);
        certificateManager = new CertificateManager(permissions);
        artifacts = new InstanceArtifacts(config, registry, new ConfigGenerator(config),
                certificateManager, authStore, permissions);
        supervisor = new ProcessSupervisor(config, registry, artifacts, locks);
        supervisor.addListener(this::onHealthChange);

        asyncExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "FleetManager-Async");
            t.setDaemon(true);
            return t;
        });
        api = new ProxyFleetAPIImpl(this);

        initialized = true;
        LOGGER.info("Fleet manager initialized");
        LOGGER.info("  Data directory: {}", registry.getDataDirectory());
        LOGGER.info("  Instances: {}", registry.list().size());

        if (supervise) {
            supervisor.startMonitoring();
            reconcile();
        }
    }

    // ==================== Lifecycle Operations ====================

    /**
     * Create an instance. It starts with {@code desired_state=stopped}.
     *
     * @param spec instance variant and fields
     * @return future completing with the stored record
     */
    @Nonnull
    public CompletableFuture<InstanceRecord> createInstance(@Nonnull InstanceSpec spec) {
        checkInitialized();
        Objects.requireNonNull(spec, "spec");

        return CompletableFuture.supplyAsync(() -> {
            InstanceValidator.validateSpec(spec);
            InstanceRecord record = toRecord(spec);

            return locks.withLock(record.name(), () -> {
                registry.create(record);
                guarded(record.name(), () -> artifacts.materialize(record, true));
                InstanceRecord stored = registry.update(record.name(),
                        r -> r.withStatus(InstanceStatus.STOPPED, null));
                LOGGER.info("Created {} instance '{}' on port {}", spec.type(), spec.name(), spec.port());
                return stored;
            });
        }, asyncExecutor);
    }

    private InstanceRecord toRecord(InstanceSpec spec) {
        Instant now = Instant.now();
        if (spec instanceof InstanceSpec.TlsTunnel tunnel) {
            String coverDomain = tunnel.coverDomain() == null || tunnel.coverDomain().isEmpty()
                    ? null : tunnel.coverDomain();
            Integer coverPort = coverDomain != null ? PortAllocator.coverPortFor(tunnel.port()) : null;
            return new InstanceRecord(tunnel.name(), ProxyType.TLS_TUNNEL, tunnel.port(), false, false,
                    tunnel.forwardAddress(), coverDomain, coverPort, tunnel.certificate(),
                    DesiredState.STOPPED, InstanceStatus.INITIALIZING, null, now, now);
        }
        InstanceSpec.ForwardProxy proxy = (InstanceSpec.ForwardProxy) spec;
        return new InstanceRecord(proxy.name(), ProxyType.FORWARD_PROXY, proxy.port(), proxy.httpsEnabled(),
                proxy.dpiEvasionEnabled(), null, null, null, proxy.certificate(),
                DesiredState.STOPPED, InstanceStatus.INITIALIZING, null, now, now);
    }

    /**
     * Record the intent to run, then start the daemon. Idempotent.
     *
     * @param name instance name
     * @return future completing with the running instance
     */
    @Nonnull
    public CompletableFuture<InstanceRecord> startInstance(@Nonnull String name) {
        checkInitialized();
        Objects.requireNonNull(name, "name");

        return CompletableFuture.supplyAsync(() -> locks.withLock(name, () -> {
            InstanceRecord record = registry.update(name, r -> r.withDesiredState(DesiredState.RUNNING));
            return startLocked(record);
        }), asyncExecutor);
    }

    /**
     * Record the intent to stop, then stop the daemon. Idempotent.
     *
     * @param name instance name
     * @return future completing with the stopped instance
     */
    @Nonnull
    public CompletableFuture<InstanceRecord> stopInstance(@Nonnull String name) {
        checkInitialized();
        Objects.requireNonNull(name, "name");

        return CompletableFuture.supplyAsync(() -> locks.withLock(name, () -> {
            registry.update(name, r -> r.withDesiredState(DesiredState.STOPPED));
            guarded(name, () -> supervisor.stop(name));
            return registry.update(name, r -> r.withStatus(InstanceStatus.STOPPED, null));
        }), asyncExecutor);
    }

    /**
     * Stop then start the daemon. The desired state is left unchanged.
     *
     * @param name instance name
     * @return future completing with the running instance
     */
    @Nonnull
    public CompletableFuture<InstanceRecord> restartInstance(@Nonnull String name) {
        checkInitialized();
        Objects.requireNonNull(name, "name");

        return CompletableFuture.supplyAsync(() -> locks.withLock(name, () -> {
            InstanceRecord record = registry.require(name);
            guarded(name, () -> supervisor.restart(record));
            return registry.update(name, r -> r.withStatus(InstanceStatus.RUNNING, null));
        }), asyncExecutor);
    }

    /**
     * Apply a partial update.
     *
     * <p>Every field is validated before anything is written. The record is
     * rewritten, then the artifacts; a certificate is generated when the
     * instance starts serving TLS or its certificate parameters change. A
     * running daemon is restarted with the new configuration.</p>
     *
     * @param name instance name
     * @param update fields to change
     * @return future completing with the updated instance
     */
    @Nonnull
    public CompletableFuture<InstanceRecord> updateInstance(@Nonnull String name, @Nonnull InstanceUpdate update) {
        checkInitialized();
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(update, "update");

        return CompletableFuture.supplyAsync(() -> locks.withLock(name, () -> {
            InstanceRecord current = registry.require(name);
            if (update.isEmpty()) {
                return current;
            }

            InstanceRecord updated = applyUpdate(current, update);
            boolean regenerate = updated.usesCertificate()
                    && (!current.usesCertificate()
                    || !artifacts.resolveCertificateParams(current)
                    .equals(artifacts.resolveCertificateParams(updated)));

            InstanceRecord stored = registry.update(name, r -> updated);
            guarded(name, () -> artifacts.materialize(stored, regenerate));
            LOGGER.info("Updated instance '{}'{}", name, regenerate ? " (certificate regenerated)" : "");

            if (supervisor.isRunning(name)) {
                guarded(name, () -> supervisor.restart(stored));
                return registry.update(name, r -> r.withStatus(InstanceStatus.RUNNING, null));
            }
            return stored;
        }), asyncExecutor);
    }

    private InstanceRecord applyUpdate(InstanceRecord current, InstanceUpdate update) {
        boolean tunnel = current.proxyType() == ProxyType.TLS_TUNNEL;
        if (tunnel && (update.getHttpsEnabled() != null || update.getDpiEvasionEnabled() != null)) {
            throw new ValidationException("https_enabled and dpi_evasion_enabled apply only to forward_proxy instances");
        }
        if (!tunnel && (update.getForwardAddress() != null || update.getCoverDomain() != null
                || update.isClearCoverDomain())) {
            throw new ValidationException("forward_address and cover_domain apply only to tls_tunnel instances");
        }
        if (update.getCoverDomain() != null && update.isClearCoverDomain()) {
            throw new ValidationException("cover_domain cannot be set and cleared at once");
        }

        int port = update.getPort() != null ? update.getPort() : current.port();
        registry.getPortAllocator().validate(port);

        String coverDomain = current.coverDomain();
        if (update.isClearCoverDomain()) {
            coverDomain = null;
        } else if (update.getCoverDomain() != null) {
            InstanceValidator.validateCoverDomain(update.getCoverDomain());
            coverDomain = update.getCoverDomain();
        }
        Integer coverPort = tunnel && coverDomain != null ? PortAllocator.coverPortFor(port) : null;

        InstanceRecord updated = current.withPort(port, coverPort).withCoverDomain(coverDomain);
        if (update.getForwardAddress() != null) {
            InstanceValidator.validateForwardAddress(update.getForwardAddress());
            updated = updated.withForwardAddress(update.getForwardAddress());
        }
        if (update.getHttpsEnabled() != null) {
            updated = updated.withHttpsEnabled(update.getHttpsEnabled());
        }
        if (update.getDpiEvasionEnabled() != null) {
            updated = updated.withDpiEvasionEnabled(update.getDpiEvasionEnabled());
        }
        if (update.getCertificate() != null) {
            InstanceValidator.validateCertificateParams(update.getCertificate());
            updated = updated.withCertificate(update.getCertificate());
        }
        return updated;
    }

    /**
     * Stop the daemon and remove the instance with all its artifacts.
     * If the daemon cannot be stopped nothing is removed.
     *
     * @param name instance name
     * @return future completing once the instance is gone
     */
    @Nonnull
    public CompletableFuture<Void> deleteInstance(@Nonnull String name) {
        checkInitialized();
        Objects.requireNonNull(name, "name");

        return CompletableFuture.runAsync(() -> locks.runLocked(name, () -> {
            InstanceLayout layout = registry.layout(name);
            registry.require(name);
            guarded(name, () -> supervisor.stop(name));
            registry.delete(name);
            authStore.forget(layout);
            LOGGER.info("Deleted instance '{}'", name);
        }), asyncExecutor);
    }

    // ==================== Users ====================

    /**
     * Add a basic-auth user to a forward proxy. The daemon re-reads the
     * credential file on its own, so no restart is needed.
     *
     * @param name instance name
     * @param username username
     * @param password plain-text password
     * @return future completing when the credential file is written
     */
    @Nonnull
    public CompletableFuture<Void> addUser(@Nonnull String name, @Nonnull String username, @Nonnull String password) {
        checkInitialized();
        return CompletableFuture.runAsync(() -> locks.runLocked(name, () ->
                authStore.add(forwardProxyLayout(name), username, password)), asyncExecutor);
    }

    /**
     * Remove a basic-auth user from a forward proxy.
     *
     * @param name instance name
     * @param username username
     * @return future completing when the credential file is written
     */
    @Nonnull
    public CompletableFuture<Void> removeUser(@Nonnull String name, @Nonnull String username) {
        checkInitialized();
        return CompletableFuture.runAsync(() -> locks.runLocked(name, () ->
                authStore.remove(forwardProxyLayout(name), username)), asyncExecutor);
    }

    /**
     * List the usernames of a forward proxy.
     *
     * @param name instance name
     * @return sorted usernames
     */
    @Nonnull
    public List<String> listUsers(@Nonnull String name) {
        checkInitialized();
        return authStore.list(forwardProxyLayout(name));
    }

    private InstanceLayout forwardProxyLayout(String name) {
        InstanceRecord record = registry.require(name);
        if (record.proxyType() != ProxyType.FORWARD_PROXY) {
            throw new ValidationException("Users are only supported on forward_proxy instances");
        }
        return registry.layout(name);
    }

    // ==================== Certificates ====================

    /**
     * Replace the certificate of an instance and restart a running daemon.
     *
     * @param name instance name
     * @param params new parameters, or null to reuse the stored ones
     * @return future completing with the new certificate's details
     */
    @Nonnull
    public CompletableFuture<CertificateDetails> regenerateCertificate(@Nonnull String name,
                                                                       @Nullable CertificateParams params) {
        checkInitialized();
        Objects.requireNonNull(name, "name");

        return CompletableFuture.supplyAsync(() -> locks.withLock(name, () -> {
            InstanceRecord current = registry.require(name);
            if (!current.usesCertificate()) {
                throw new ValidationException("Instance '" + name + "' does not serve TLS");
            }
            if (params != null) {
                InstanceValidator.validateCertificateParams(params);
            }

            InstanceRecord record = params != null
                    ? registry.update(name, r -> r.withCertificate(params))
                    : current;
            CertificateDetails details = guarded(name, () -> certificateManager.generate(
                    registry.layout(name), artifacts.resolveCertificateParams(record)));

            if (supervisor.isRunning(name)) {
                guarded(name, () -> supervisor.restart(record));
                registry.update(name, r -> r.withStatus(InstanceStatus.RUNNING, null));
            }
            return details;
        }), asyncExecutor);
    }

    /**
     * Read the certificate of an instance.
     *
     * @param name instance name
     * @return certificate details, or null if the instance does not serve TLS
     */
    @Nullable
    public CertificateDetails getCertificate(@Nonnull String name) {
        checkInitialized();
        InstanceRecord record = registry.require(name);
        return record.usesCertificate() ? certificateManager.info(registry.layout(name)) : null;
    }

    // ==================== Reconciliation ====================

    /**
     * Start every instance whose desired state is running and correct stale
     * statuses of the others.
     *
     * @return what happened
     */
    @Nonnull
    public ReconcileReport reconcile() {
        checkInitialized();
        LOGGER.info("Reconciling desired states...");

        DesiredStateReconciler reconciler = new DesiredStateReconciler(new DesiredStateReconciler.ActionExecutor() {
            @Override
            public void start(@Nonnull String name) {
                locks.withLock(name, () -> startLocked(registry.require(name)));
            }

            @Override
            public void markStopped(@Nonnull String name) {
                locks.runLocked(name, () -> registry.update(name, r -> r.withStatus(InstanceStatus.STOPPED, null)));
            }
        });
        return reconciler.reconcile(registry.list(), supervisor::isRunning);
    }

    private InstanceRecord startLocked(InstanceRecord record) {
        guarded(record.name(), () -> supervisor.start(record));
        return registry.update(record.name(), r -> r.withStatus(InstanceStatus.RUNNING, null));
    }

    /**
     * Run a step whose failure leaves the instance in error. The reason is
     * persisted before the exception propagates; the desired state is untouched.
     */
    private <T> T guarded(String name, Supplier<T> step) {
        try {
            return step.get();
        } catch (RuntimeException e) {
            markError(name, e);
            throw e;
        }
    }

    private void markError(String name, RuntimeException cause) {
        try {
            registry.update(name, r -> r.withStatus(InstanceStatus.ERROR, cause.getMessage()));
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            LOGGER.error("Failed to record error status of '{}': {}", name, e.getMessage());
        }
    }

    // ==================== Health ====================

    private void onHealthChange(InstanceHealthEvent event) {
        if (shutdown) {
            return;
        }
        asyncExecutor.execute(() -> handleUnexpectedExit(event));
    }

    private void handleUnexpectedExit(InstanceHealthEvent event) {
        String name = event.getInstanceName();
        InstanceHealthEvent recorded;
        try {
            recorded = locks.withLock(name, () -> {
                InstanceRecord record = registry.get(name);
                if (record == null || supervisor.isRunning(name)) {
                    return null;
                }
                InstanceStatus status = record.desiredState() == DesiredState.RUNNING
                        ? InstanceStatus.ERROR
                        : InstanceStatus.STOPPED;
                registry.update(name, r -> r.withStatus(status, event.getMessage()));
                return new InstanceHealthEvent(name, record.status(), status, event.getMessage());
            });
        } catch (RuntimeException e) {
            LOGGER.error("Failed to record exit of '{}': {}", name, e.getMessage());
            return;
        }
        if (recorded == null) {
            return;
        }
        LOGGER.warn("Instance '{}' is now {}: {}", name, recorded.getNewStatus(), recorded.getMessage());
        for (InstanceEventListener listener : listeners) {
            try {
                listener.onHealthChange(recorded);
            } catch (RuntimeException e) {
                LOGGER.error("Health listener failed for '{}'", name, e);
            }
        }
    }

    /**
     * Register a listener for unexpected status changes.
     *
     * @param listener the listener
     */
    public void addListener(@Nonnull InstanceEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(@Nonnull InstanceEventListener listener) {
        listeners.remove(listener);
    }

    // ==================== Queries ====================

    /**
     * Get an instance record.
     *
     * @param name instance name
     * @return the record, or null if not found
     */
    @Nullable
    public InstanceRecord getInstance(@Nonnull String name) {
        checkInitialized();
        return registry.get(name);
    }

    /**
     * Get all instance records, sorted by name.
     *
     * @return records
     */
    @Nonnull
    public List<InstanceRecord> listInstances() {
        checkInitialized();
        return registry.list();
    }

    /**
     * Get the last lines written by an instance's daemon.
     *
     * @param name instance name
     * @param lines maximum number of lines
     * @return log lines, oldest first
     */
    @Nonnull
    public List<String> getRecentLogs(@Nonnull String name, int lines) {
        checkInitialized();
        registry.require(name);
        return supervisor.getRecentLogs(name, lines);
    }

    /**
     * Get fleet statistics.
     *
     * @return statistics
     */
    @Nonnull
    public Stats getStats() {
        checkInitialized();
        int forward = 0;
        int tunnels = 0;
        int running = 0;
        int stopped = 0;
        int failed = 0;
        int users = 0;
        List<InstanceRecord> records = registry.list();
        for (InstanceRecord record : records) {
            if (record.proxyType() == ProxyType.FORWARD_PROXY) {
                forward++;
                users += authStore.count(registry.layout(record.name()));
            } else {
                tunnels++;
            }
            switch (record.status()) {
                case RUNNING -> running++;
                case ERROR -> failed++;
                default -> stopped++;
            }
        }
        return new Stats(records.size(), forward, tunnels, running, stopped, failed, users);
    }

    @Nonnull
    public FleetConfig getConfig() {
        return config;
    }

    @Nonnull
    public ProxyFleetAPI getApi() {
        checkInitialized();
        return api;
    }

    @Nonnull
    public InstanceRegistry getRegistry() {
        checkInitialized();
        return registry;
    }

    @Nonnull
    public ProcessSupervisor getSupervisor() {
        checkInitialized();
        return supervisor;
    }

    @Nonnull
    public AuthStore getAuthStore() {
        checkInitialized();
        return authStore;
    }

    // ==================== Lifecycle ====================

    public boolean isInitialized() {
        return initialized;
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Fleet manager not initialized");
        }
        if (shutdown) {
            throw new IllegalStateException("Fleet manager is shut down");
        }
    }

    /**
     * Stop every daemon and the worker pool. Desired states are kept, so the
     * next {@link #initialize()} brings the same instances back up.
     */
    public void shutdown() {
        if (!initialized || shutdown) {
            return;
        }
        LOGGER.info("Shutting down fleet manager...");

        for (String name : new ArrayList<>(supervisor.getTrackedNames())) {
            try {
                locks.runLocked(name, () -> {
                    supervisor.stop(name);
                    registry.update(name, r -> r.withStatus(InstanceStatus.STOPPED, null));
                });
            } catch (RuntimeException e) {
                LOGGER.error("Failed to stop '{}' during shutdown: {}", name, e.getMessage());
            }
        }
        shutdown = true;
        supervisor.shutdown();

        asyncExecutor.shutdown();
        try {
            if (!asyncExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                asyncExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            asyncExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        LOGGER.info("Fleet manager shut down");
    }

    /**
     * Fleet statistics.
     */
    public record Stats(
            int totalInstances,
            int forwardProxies,
            int tlsTunnels,
            int runningInstances,
            int stoppedInstances,
            int failedInstances,
            int totalUsers
    ) {}
}
