package me.internalizable.proxyfleet.manager.process;

import me.internalizable.proxyfleet.api.error.ProcessException;
import me.internalizable.proxyfleet.manager.config.FleetConfig;
import me.internalizable.proxyfleet.manager.registry.InstanceLayout;
import me.internalizable.proxyfleet.manager.registry.InstanceRecord;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Command line and environment that launch the daemon of one instance.
 *
 * <p>Arguments come from the fleet configuration with the placeholders
 * {@code {config}}, {@code {name}}, {@code {port}}, {@code {dir}} and
 * {@code {logs}} replaced by the instance's values.</p>
 */
public final class DaemonCommand {

    private final List<String> command;
    private final Map<String, String> environment;
    private final Path workingDirectory;

    private DaemonCommand(List<String> command, Map<String, String> environment, Path workingDirectory) {
        this.command = Collections.unmodifiableList(command);
        this.environment = Collections.unmodifiableMap(environment);
        this.workingDirectory = workingDirectory;
    }

    /**
     * Build the command for an instance.
     *
     * @param record instance record
     * @param layout instance layout
     * @param daemon settings of the instance's daemon kind
     * @return the command
     * @throws ProcessException if no binary is configured
     */
    @Nonnull
    public static DaemonCommand forInstance(
            @Nonnull InstanceRecord record,
            @Nonnull InstanceLayout layout,
            @Nonnull FleetConfig.DaemonConfig daemon) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(daemon, "daemon");

        String binary = daemon.getBinary();
        if (binary == null || binary.isBlank()) {
            throw new ProcessException("No daemon binary configured for " + record.proxyType());
        }

        Map<String, String> values = new HashMap<>();
        values.put("{config}", layout.getConfigFile(record.proxyType()).toString());
        values.put("{name}", record.name());
        values.put("{port}", Integer.toString(record.port()));
        values.put("{dir}", layout.getDirectory().toString());
        values.put("{logs}", layout.getLogsDirectory().toString());

        List<String> command = new ArrayList<>();
        command.add(binary);
        if (daemon.getArguments() != null) {
            for (String argument : daemon.getArguments()) {
                command.add(substitute(argument, values));
            }
        }

        Map<String, String> environment = new HashMap<>();
        environment.put("PROXYFLEET_INSTANCE", record.name());
        if (daemon.getEnvironment() != null) {
            for (Map.Entry<String, String> entry : daemon.getEnvironment().entrySet()) {
                environment.put(entry.getKey(), substitute(entry.getValue(), values));
            }
        }

        return new DaemonCommand(command, environment, layout.getDirectory());
    }

    private static String substitute(String value, Map<String, String> values) {
        String result = value;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            result = result.replace(entry.getKey(), entry.getValue());
        }
        return result;
    }

    @Nonnull
    public List<String> getCommand() {
        return command;
    }

    @Nonnull
    public Map<String, String> getEnvironment() {
        return environment;
    }

    @Nonnull
    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    @Override
    public String toString() {
        return String.join(" ", command);
    }
}
