package me.internalizable.proxyfleet.manager.process;

import me.internalizable.proxyfleet.api.InstanceStatus;
import me.internalizable.proxyfleet.api.ProxyType;
import me.internalizable.proxyfleet.api.error.ProcessException;
import me.internalizable.proxyfleet.manager.config.FleetConfig;
import me.internalizable.proxyfleet.manager.event.InstanceEventListener;
import me.internalizable.proxyfleet.manager.event.InstanceHealthEvent;
import me.internalizable.proxyfleet.manager.instance.InstanceArtifacts;
import me.internalizable.proxyfleet.manager.registry.InstanceLayout;
import me.internalizable.proxyfleet.manager.registry.InstanceRecord;
import me.internalizable.proxyfleet.manager.registry.InstanceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Spawns, monitors and stops the daemon processes of the fleet.
 *
 * <p>The supervisor owns the only map from instance name to live process.
 * Every start, stop and restart runs under the instance's lock from
 * {@link InstanceLocks}, which guarantees at most one process per name.
 * A single monitor thread polls tracked processes; a daemon that exits
 * without being asked to is dropped from the map and reported to listeners,
 * never restarted automatically.</p>
 *
 * <p>Before spawning, the supervisor checks that the instance's port can be
 * bound. A port held by some other process (for example an orphaned daemon
 * of a previous manager run) fails the start rather than being adopted or
 * killed.</p>
 */
public class ProcessSupervisor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessSupervisor.class);

    private static final long READY_POLL_MILLIS = 100;
    private static final int CONNECT_TIMEOUT_MILLIS = 200;
    private static final int FAILURE_LOG_LINES = 10;

    private final FleetConfig config;
    private final InstanceRegistry registry;
    private final InstanceArtifacts artifacts;
    private final InstanceLocks locks;

    private final Map<String, ManagedProcess> processes = new ConcurrentHashMap<>();
    private final List<InstanceEventListener> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService monitorExecutor;

    private volatile boolean monitoring = false;
    private volatile boolean shutdown = false;

    /**
     * Create a process supervisor.
     *
     * @param config fleet configuration
     * @param registry instance registry, for layouts
     * @param artifacts writes configuration before each start
     * @param locks per-instance locks shared with the manager
     */
    public ProcessSupervisor(
            @Nonnull FleetConfig config,
            @Nonnull InstanceRegistry registry,
            @Nonnull InstanceArtifacts artifacts,
            @Nonnull InstanceLocks locks) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.monitorExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ProcessMonitor");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the health monitor.
     */
    public synchronized void startMonitoring() {
        if (monitoring) {
            return;
        }
        int interval = Math.max(1, config.getHealthCheckIntervalSeconds());
        monitorExecutor.scheduleWithFixedDelay(this::checkProcesses, interval, interval, TimeUnit.SECONDS);
        monitoring = true;
        LOGGER.info("Process monitor started (interval {}s)", interval);
    }

    // ==================== Start ====================

    /**
     * Start the daemon of an instance and wait until its port accepts connections.
     *
     * <p>Idempotent: if a live process is already tracked for the name it is
     * returned and nothing is spawned.</p>
     *
     * @param record instance record
     * @return the running process
     * @throws ProcessException if the daemon cannot be spawned, exits early,
     *         cannot bind its port or does not become ready in time
     */
    @Nonnull
    public ManagedProcess start(@Nonnull InstanceRecord record) {
        Objects.requireNonNull(record, "record");
        checkNotShutdown();

        return locks.withLock(record.name(), () -> {
            ManagedProcess existing = processes.get(record.name());
            if (existing != null && existing.isAlive()) {
                LOGGER.debug("Instance '{}' already running with PID {}", record.name(), existing.getPid());
                return existing;
            }
            if (existing != null) {
                processes.remove(record.name(), existing);
            }

            artifacts.prepare(record);
            checkPortFree(record.name(), record.port());
            if (record.hasCoverSite()) {
                checkPortFree(record.name(), record.coverPort());
            }

            ManagedProcess managed = spawn(record);
            try {
                awaitReady(managed);
            } catch (ProcessException e) {
                managed.markStopRequested();
                terminate(managed);
                throw e;
            }

            processes.put(record.name(), managed);
            LOGGER.info("Instance '{}' started with PID {} on port {}",
                    record.name(), managed.getPid(), record.port());
            return managed;
        });
    }

    private ManagedProcess spawn(InstanceRecord record) {
        InstanceLayout layout = registry.layout(record.name());
        DaemonCommand command = DaemonCommand.forInstance(record, layout, daemonConfig(record.proxyType()));

        LOGGER.info("Spawning {} for '{}' on port {}", record.proxyType(), record.name(), record.port());
        LOGGER.debug("Command: {}", command);

        ProcessBuilder builder = new ProcessBuilder(command.getCommand());
        builder.directory(command.getWorkingDirectory().toFile());
        builder.redirectErrorStream(true);
        builder.environment().putAll(command.getEnvironment());

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ProcessException("Failed to spawn daemon for '" + record.name() + "': "
                    + e.getMessage(), e);
        }

        ManagedProcess managed = new ManagedProcess(
                record.name(), record.proxyType(), record.port(), process, layout.getDaemonLog());
        startLogCapture(managed);
        return managed;
    }

    private void checkPortFree(String name, int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(port));
        } catch (IOException e) {
            throw new ProcessException("Cannot start '" + name + "': port " + port
                    + " is already bound by another process");
        }
    }

    private void awaitReady(ManagedProcess managed) {
        long deadline = System.currentTimeMillis()
                + TimeUnit.SECONDS.toMillis(Math.max(1, config.getProcessStartTimeoutSeconds()));

        while (true) {
            if (!managed.isAlive()) {
                managed.awaitLogDrain(1000);
                throw new ProcessException("Daemon for '" + managed.getInstanceName() + "' exited with code "
                        + managed.getExitCode() + " during startup" + describeOutput(managed));
            }
            if (isConnectable(managed.getPort())) {
                return;
            }
            if (System.currentTimeMillis() >= deadline) {
                throw new ProcessException("Daemon for '" + managed.getInstanceName()
                        + "' did not accept connections on port " + managed.getPort() + " within "
                        + config.getProcessStartTimeoutSeconds() + "s" + describeOutput(managed));
            }
            try {
                Thread.sleep(READY_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProcessException("Interrupted while waiting for '" + managed.getInstanceName()
                        + "' to become ready", e);
            }
        }
    }

    private static boolean isConnectable(int port) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), CONNECT_TIMEOUT_MILLIS);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    private static String describeOutput(ManagedProcess managed) {
        List<String> lines = managed.getRecentLogs(FAILURE_LOG_LINES);
        return lines.isEmpty() ? "" : ": " + String.join(" | ", lines);
    }

    private void startLogCapture(ManagedProcess managed) {
        Thread logThread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                    managed.getProcess().getInputStream(), StandardCharsets.UTF_8));
                 BufferedWriter writer = Files.newBufferedWriter(managed.getLogFile(), StandardCharsets.UTF_8,
                         StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {

                String line;
                while ((line = reader.readLine()) != null) {
                    writer.write(line);
                    writer.newLine();
                    writer.flush();
                    managed.addLogLine(line);
                }
            } catch (IOException e) {
                if (!shutdown && !managed.isStopRequested()) {
                    LOGGER.error("Error capturing logs for '{}': {}", managed.getInstanceName(), e.getMessage());
                }
            }
        }, "LogCapture-" + managed.getInstanceName());
        logThread.setDaemon(true);
        managed.setLogCapture(logThread);
        logThread.start();
    }

    // ==================== Stop ====================

    /**
     * Stop the daemon of an instance: terminate, wait up to the stop timeout,
     * then kill. Idempotent.
     *
     * @param name instance name
     * @return true if a process was stopped, false if none was tracked
     */
    public boolean stop(@Nonnull String name) {
        Objects.requireNonNull(name, "name");
        return locks.withLock(name, () -> {
            ManagedProcess managed = processes.remove(name);
            if (managed == null) {
                return false;
            }
            managed.markStopRequested();
            terminate(managed);
            return true;
        });
    }

    /**
     * Stop then start an instance's daemon.
     *
     * @param record instance record
     * @return the new process
     */
    @Nonnull
    public ManagedProcess restart(@Nonnull InstanceRecord record) {
        Objects.requireNonNull(record, "record");
        return locks.withLock(record.name(), () -> {
            stop(record.name());
            return start(record);
        });
    }

    private void terminate(ManagedProcess managed) {
        Process process = managed.getProcess();
        String name = managed.getInstanceName();
        if (!process.isAlive()) {
            return;
        }

        LOGGER.info("Requesting graceful shutdown for '{}'", name);
        process.destroy();
        try {
            if (process.waitFor(Math.max(1, config.getProcessStopTimeoutSeconds()), TimeUnit.SECONDS)) {
                LOGGER.info("Instance '{}' shut down gracefully", name);
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        LOGGER.warn("Instance '{}' did not shut down gracefully, forcing...", name);
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                throw new ProcessException("Daemon for '" + name + "' (PID " + process.pid()
                        + ") survived a forced kill");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessException("Interrupted while killing '" + name + "'", e);
        }
        LOGGER.info("Instance '{}' forcibly terminated", name);
    }

    // ==================== Monitoring ====================

    private void checkProcesses() {
        for (Map.Entry<String, ManagedProcess> entry : processes.entrySet()) {
            ManagedProcess managed = entry.getValue();
            if (managed.isAlive() || managed.isStopRequested()) {
                continue;
            }
            if (!processes.remove(entry.getKey(), managed)) {
                continue;
            }
            managed.awaitLogDrain(500);
            Integer exitCode = managed.getExitCode();
            LOGGER.warn("Instance '{}' exited unexpectedly with code {}", managed.getInstanceName(), exitCode);
            fire(new InstanceHealthEvent(managed.getInstanceName(), InstanceStatus.RUNNING, InstanceStatus.ERROR,
                    "Daemon exited unexpectedly with code " + exitCode));
        }
    }

    private void fire(InstanceHealthEvent event) {
        for (InstanceEventListener listener : listeners) {
            try {
                listener.onHealthChange(event);
            } catch (RuntimeException e) {
                LOGGER.error("Health listener failed for '{}'", event.getInstanceName(), e);
            }
        }
    }

    public void addListener(@Nonnull InstanceEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ==================== Queries ====================

    /**
     * Check if an instance has a live process.
     *
     * @param name instance name
     * @return true if running
     */
    public boolean isRunning(@Nonnull String name) {
        ManagedProcess managed = processes.get(name);
        return managed != null && managed.isAlive();
    }

    /**
     * Get the tracked process of an instance.
     *
     * @param name instance name
     * @return the process, or null if none is tracked
     */
    @Nullable
    public ManagedProcess getProcess(@Nonnull String name) {
        return processes.get(name);
    }

    /**
     * Get the names of all instances with a tracked process.
     *
     * @return instance names
     */
    @Nonnull
    public Set<String> getTrackedNames() {
        return Collections.unmodifiableSet(processes.keySet());
    }

    /**
     * Get the last lines written by an instance's daemon. Falls back to the
     * daemon log file when no process is tracked.
     *
     * @param name instance name
     * @param lines maximum number of lines
     * @return log lines, oldest first
     */
    @Nonnull
    public List<String> getRecentLogs(@Nonnull String name, int lines) {
        if (lines <= 0) {
            return List.of();
        }
        ManagedProcess managed = processes.get(name);
        if (managed != null) {
            return managed.getRecentLogs(lines);
        }

        Path logFile = registry.layout(name).getDaemonLog();
        try {
            List<String> all = Files.readAllLines(logFile, StandardCharsets.UTF_8);
            return new ArrayList<>(all.subList(Math.max(0, all.size() - lines), all.size()));
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            LOGGER.warn("Failed to read daemon log of '{}': {}", name, e.getMessage());
            return List.of();
        }
    }

    // ==================== Shutdown ====================

    /**
     * Stop every tracked process and the monitor.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        LOGGER.info("Shutting down process supervisor...");

        for (String name : new ArrayList<>(processes.keySet())) {
            try {
                stop(name);
            } catch (ProcessException e) {
                LOGGER.error("Failed to stop '{}' during shutdown: {}", name, e.getMessage());
            }
        }
        shutdown = true;

        monitorExecutor.shutdown();
        try {
            if (!monitorExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                monitorExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            monitorExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        LOGGER.info("Process supervisor shut down");
    }

    private void checkNotShutdown() {
        if (shutdown) {
            throw new IllegalStateException("Process supervisor is shut down");
        }
    }

    private FleetConfig.DaemonConfig daemonConfig(ProxyType type) {
        return type == ProxyType.TLS_TUNNEL ? config.getTlsTunnel() : config.getForwardProxy();
    }
}
