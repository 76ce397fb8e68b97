package me.internalizable.proxyfleet.manager.process;

import me.internalizable.proxyfleet.api.ProxyType;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;

/**
 * A daemon process backing one instance.
 *
 * <p>Wraps a Java {@link Process} with the instance it serves and a buffer of
 * the last lines it wrote to stdout or stderr.</p>
 */
public class ManagedProcess {

    private static final int MAX_LOG_BUFFER = 1000;

    private final String instanceName;
    private final ProxyType proxyType;
    private final int port;
    private final Process process;
    private final Path logFile;
    private final long startTime;
    private final LinkedList<String> logBuffer = new LinkedList<>();

    private volatile Thread logCapture;
    private volatile boolean stopRequested = false;

    /**
     * Create a managed process.
     *
     * @param instanceName instance name
     * @param proxyType daemon kind
     * @param port listening port
     * @param process the Java process
     * @param logFile file receiving the daemon's output
     */
    public ManagedProcess(
            @Nonnull String instanceName,
            @Nonnull ProxyType proxyType,
            int port,
            @Nonnull Process process,
            @Nonnull Path logFile) {
        this.instanceName = Objects.requireNonNull(instanceName, "instanceName");
        this.proxyType = Objects.requireNonNull(proxyType, "proxyType");
        this.port = port;
        this.process = Objects.requireNonNull(process, "process");
        this.logFile = Objects.requireNonNull(logFile, "logFile");
        this.startTime = System.currentTimeMillis();
    }

    @Nonnull
    public String getInstanceName() {
        return instanceName;
    }

    public int getPort() {
        return port;
    }

    @Nonnull
    public Process getProcess() {
        return process;
    }

    public long getPid() {
        return process.pid();
    }

    @Nonnull
    public Path getLogFile() {
        return logFile;
    }

    /**
     * Get the process uptime.
     *
     * @return uptime in milliseconds
     */
    public long getUptime() {
        return System.currentTimeMillis() - startTime;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Get the exit code if the process has terminated.
     *
     * @return exit code, or null if still running
     */
    @Nullable
    public Integer getExitCode() {
        return process.isAlive() ? null : process.exitValue();
    }

    /**
     * Check whether the supervisor asked this process to stop. An exit after
     * that is expected and not reported as a failure.
     *
     * @return true if a stop was requested
     */
    public boolean isStopRequested() {
        return stopRequested;
    }

    void markStopRequested() {
        this.stopRequested = true;
    }

    void setLogCapture(@Nonnull Thread logCapture) {
        this.logCapture = logCapture;
    }

    /**
     * Wait for the log capture thread to read the remaining output of an
     * exited process.
     *
     * @param timeoutMillis maximum wait
     */
    void awaitLogDrain(long timeoutMillis) {
        Thread thread = logCapture;
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Add a log line to the buffer.
     *
     * @param line log line
     */
    synchronized void addLogLine(@Nonnull String line) {
        logBuffer.addLast(line);
        while (logBuffer.size() > MAX_LOG_BUFFER) {
            logBuffer.removeFirst();
        }
    }

    /**
     * Get recent log lines.
     *
     * @param count number of lines to retrieve
     * @return list of log lines (most recent last)
     */
    @Nonnull
    public synchronized List<String> getRecentLogs(int count) {
        if (count <= 0) {
            return Collections.emptyList();
        }

        int size = logBuffer.size();
        if (count >= size) {
            return new ArrayList<>(logBuffer);
        }
        return new ArrayList<>(logBuffer.subList(size - count, size));
    }

    @Override
    public String toString() {
        return "ManagedProcess{" +
                "instance='" + instanceName + '\'' +
                ", type=" + proxyType +
                ", port=" + port +
                ", pid=" + getPid() +
                ", alive=" + isAlive() +
                ", uptime=" + getUptime() + "ms" +
                '}';
    }
}
