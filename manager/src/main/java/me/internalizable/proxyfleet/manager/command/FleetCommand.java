package me.internalizable.proxyfleet.manager.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.internalizable.proxyfleet.api.CertificateDetails;
import me.internalizable.proxyfleet.api.CertificateParams;
import me.internalizable.proxyfleet.api.InstanceSpec;
import me.internalizable.proxyfleet.api.InstanceUpdate;
import me.internalizable.proxyfleet.api.error.FleetException;
import me.internalizable.proxyfleet.api.error.NotFoundException;
import me.internalizable.proxyfleet.manager.FleetManager;
import me.internalizable.proxyfleet.manager.config.FleetConfig;
import me.internalizable.proxyfleet.manager.registry.InstanceRecord;
import me.internalizable.proxyfleet.manager.registry.RecordMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.function.Function;

/**
 * Command line entry point of the fleet manager.
 *
 * <p>{@code run} starts the supervisor and keeps it in the foreground. Every
 * other subcommand works on the data directory directly and never spawns a
 * daemon; instances change state through {@code run} on the next start.</p>
 *
 * <p>Usage:</p>
 * <ul>
 *   <li>{@code proxyfleet run} - Supervise all instances until interrupted</li>
 *   <li>{@code proxyfleet list} - List instances as JSON</li>
 *   <li>{@code proxyfleet info <name>} - Show one instance</li>
 *   <li>{@code proxyfleet create-forward <name> --port=N [--https] [--dpi-evasion]} - Create a forward proxy</li>
 *   <li>{@code proxyfleet create-tunnel <name> --port=N --forward=host:port [--cover-domain=D]} - Create a TLS tunnel</li>
 *   <li>{@code proxyfleet update <name> [options]} - Change fields of an instance</li>
 *   <li>{@code proxyfleet delete <name>} - Remove an instance</li>
 *   <li>{@code proxyfleet user add|remove|list} - Manage basic-auth users</li>
 *   <li>{@code proxyfleet cert info|regenerate <name>} - Inspect or replace a certificate</li>
 *   <li>{@code proxyfleet logs <name> [--tail=N]} - Show daemon output</li>
 *   <li>{@code proxyfleet stats} - Show fleet statistics</li>
 * </ul>
 */
@Command(
        name = "proxyfleet",
        mixinStandardHelpOptions = true,
        description = "Forward proxy and TLS tunnel instance manager",
        subcommands = {
                FleetCommand.RunCommand.class,
                FleetCommand.ListCommand.class,
                FleetCommand.InfoCommand.class,
                FleetCommand.CreateForwardCommand.class,
                FleetCommand.CreateTunnelCommand.class,
                FleetCommand.UpdateCommand.class,
                FleetCommand.DeleteCommand.class,
                FleetCommand.UserCommand.class,
                FleetCommand.CertCommand.class,
                FleetCommand.LogsCommand.class,
                FleetCommand.StatsCommand.class
        }
)
public final class FleetCommand implements Runnable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FleetCommand.class);

    private static final ObjectMapper MAPPER = RecordMapper.create();

    @Option(names = {"--config"}, description = "Path to manager.yml", defaultValue = "manager.yml")
    String config;

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        int code = newCommandLine().execute(args);
        System.exit(code);
    }

    /**
     * Create the command line with error reporting for manager failures.
     *
     * @return configured command line
     */
    public static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new FleetCommand());
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof FleetException) {
                FleetException failure = (FleetException) cause;
                cmd.getErr().println("error (" + failure.getKind().name().toLowerCase() + "): " + failure.getMessage());
                return 1;
            }
            throw ex;
        });
        return commandLine;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    FleetConfig loadConfig() {
        try {
            return FleetConfig.load(Paths.get(config));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + config, e);
        }
    }

    /**
     * Run an action against a manager that does not supervise processes.
     */
    <T> T withManager(Function<FleetManager, T> action) {
        FleetManager manager = new FleetManager(loadConfig());
        try {
            manager.initialize(false);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open data directory", e);
        }
        try {
            return action.apply(manager);
        } finally {
            manager.shutdown();
        }
    }

    void printJson(Object value) {
        PrintWriter out = spec.commandLine().getOut();
        try {
            out.println(MAPPER.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
        out.flush();
    }

    private static CertificateParams certificateParams(String commonName, Integer validityDays, Integer keySize) {
        if (commonName == null && validityDays == null && keySize == null) {
            return null;
        }
        CertificateParams params = CertificateParams.defaults();
        if (commonName != null) {
            params = params.withCommonName(commonName);
        }
        if (validityDays != null) {
            params = params.withValidityDays(validityDays);
        }
        if (keySize != null) {
            params = params.withKeySize(keySize);
        }
        return params;
    }

    // ==================== Supervisor ====================

    @Command(name = "run", description = "Supervise all instances until interrupted")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        FleetCommand parent;

        @Override
        public Integer call() throws Exception {
            FleetManager manager = new FleetManager(parent.loadConfig());
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                manager.shutdown();
                stopped.countDown();
            }, "FleetManager-Shutdown"));

            manager.initialize();
            LOGGER.info("Supervising {} instance(s)", manager.listInstances().size());
            stopped.await();
            return 0;
        }
    }

    // ==================== Queries ====================

    @Command(name = "list", description = "List instances")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        FleetCommand parent;

        @Override
        public Integer call() {
            parent.printJson(parent.withManager(FleetManager::listInstances));
            return 0;
        }
    }

    @Command(name = "info", description = "Show one instance")
    static final class InfoCommand implements Callable<Integer> {
        @ParentCommand
        FleetCommand parent;

        @Parameters(index = "0", description = "Instance name")
        String name;

        @Override
        public Integer call() {
            InstanceRecord record = parent.withManager(m -> m.getRegistry().require(name));
            parent.printJson(record);
            return 0;
        }
    }

    @Command(name = "logs", description = "Show the last lines written by a daemon")
    static final class LogsCommand implements Callable<Integer> {
        @ParentCommand
        FleetCommand parent;

        @Parameters(index = "0", description = "Instance name")
        String name;

        @Option(names = {"--tail"}, defaultValue = "50", description = "Number of lines")
        int tail;

        @Override
        public Integer call() {
            PrintWriter out = parent.spec.commandLine().getOut();
            parent.withManager(m -> m.getRecentLogs(name, tail)).forEach(out::println);
            out.flush();
            return 0;
        }
    }

    @Command(name = "stats", description = "Show fleet statistics")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        FleetCommand parent;

        @Override
        public Integer call() {
            parent.printJson(parent.withManager(FleetManager::getStats));
            return 0;
        }
    }

    // ==================== Lifecycle ====================

    @Command(name = "create-forward", description = "Create a forward proxy instance")
    static final class CreateForwardCommand implements Callable<Integer> {
        @ParentCommand
        FleetCommand parent;

        @Parameters(index = "0", description = "Instance name")
        String name;

        @Option(names = {"--port"}, required = true, description = "Listening port")
        int port;

        @Option(names = {"--https"}, defaultValue = "false", description = "Serve TLS on the listening port")
        boolean https;

        @Option(names = {"--dpi-evasion"}, defaultValue = "false", description = "Strip identifying headers")
        boolean dpiEvasion;

        @Option(names = {"--cn"}, description = "Certificate common name")
        String commonName;

        @Override
        public Integer call() {
            InstanceSpec spec = new InstanceSpec.ForwardProxy(name, port, https, dpiEvasion,
                    certificateParams(commonName, null, null));
            parent.printJson(parent.withManager(m -> m.createInstance(spec).join()));
            return 0;
        }
    }

    @Command(name = "create-tunnel", description = "Create a TLS tunnel instance")
    static final class CreateTunnelCommand implements Callable<Integer> {
        @ParentCommand
        FleetCommand parent;

        @Parameters(index = "0", description = "Instance name")
        String name;

        @Option(names = {"--port"}, required = true, description = "Listening port")
        int port;

        @Option(names = {"--forward"}, required = true, description = "Upstream host:port")
        String forwardAddress;

        @Option(names = {"--cover-domain"}, description = "SNI name served by the local cover site")
        String coverDomain;

        @Option(names = {"--cn"}, description = "Certificate common name")
        String commonName;

        @Override
        public Integer call() {
            InstanceSpec spec = new InstanceSpec.TlsTunnel(name, port, forwardAddress, coverDomain,
                    certificateParams(commonName, null, null));
            parent.printJson(parent.withManager(m -> m.createInstance(spec).join()));
            return 0;
        }
    }

    @Command(name = "update", description = "Change fields of an instance")
    static final class UpdateCommand implements Callable<Integer> {
        @ParentCommand
        FleetCommand parent;

        @Parameters(index = "0", description = "Instance name")
        String name;

        @Option(names = {"--port"}, description = "Listening port")
        Integer port;

        @Option(names = {"--https"}, arity = "1", description = "true or false")
        Boolean https;

        @Option(names = {"--dpi-evasion"}, arity = "1", description = "true or false")
        Boolean dpiEvasion;

        @Option(names = {"--forward"}, description = "Upstream host:port")
        String forwardAddress;

        @Option(names = {"--cover-domain"}, description = "SNI name served by the local cover site")
        String coverDomain;

        @Option(names = {"--clear-cover-domain"}, defaultValue = "false", description = "Remove the cover site")
        boolean clearCoverDomain;

        @Option(names = {"--cn"}, description = "Certificate common name")
        String commonName;

        @Override
        public Integer call() {
            InstanceUpdate.Builder builder = InstanceUpdate.builder();
            if (port != null) {
                builder.port(port);
            }
            if (https != null) {
                builder.httpsEnabled(https);
            }
            if (dpiEvasion != null) {
                builder.dpiEvasionEnabled(dpiEvasion);
            }
            if (forwardAddress != null) {
                builder.forwardAddress(forwardAddress);
            }
            if (coverDomain != null) {
                builder.coverDomain(coverDomain);
            }
            if (clearCoverDomain) {
                builder.clearCoverDomain();
            }
            CertificateParams params = certificateParams(commonName, null, null);
            if (params != null) {
                builder.certificate(params);
            }
            InstanceUpdate update = builder.build();
            parent.printJson(parent.withManager(m -> m.updateInstance(name, update).join()));
            return 0;
        }
    }

    @Command(name = "delete", description = "Remove an instance and its files")
    static final class DeleteCommand implements Callable<Integer> {
        @ParentCommand
        FleetCommand parent;

        @Parameters(index = "0", description = "Instance name")
        String name;

        @Override
        public Integer call() {
            parent.withManager(m -> m.deleteInstance(name).join());
            parent.spec.commandLine().getOut().println("Deleted " + name);
            parent.spec.commandLine().getOut().flush();
            return 0;
        }
    }

    // ==================== Users ====================

    @Command(
            name = "user",
            description = "Manage basic-auth users of a forward proxy",
            subcommands = {
                    UserCommand.AddCommand.class,
                    UserCommand.RemoveCommand.class,
                    UserCommand.ListUsersCommand.class
            }
    )
    static final class UserCommand implements Runnable {
        @ParentCommand
        FleetCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public void run() {
            spec.commandLine().usage(spec.commandLine().getOut());
        }

        @Command(name = "add", description = "Add a user")
        static final class AddCommand implements Callable<Integer> {
            @ParentCommand
            UserCommand parent;

            @Parameters(index = "0", description = "Instance name")
            String name;

            @Parameters(index = "1", description = "Username")
            String username;

            @Option(names = {"--password"}, required = true, description = "Password")
            String password;

            @Override
            public Integer call() {
                parent.parent.withManager(m -> m.addUser(name, username, password).join());
                parent.spec.commandLine().getOut().println("Added " + username + " to " + name);
                parent.spec.commandLine().getOut().flush();
                return 0;
            }
        }

        @Command(name = "remove", description = "Remove a user")
        static final class RemoveCommand implements Callable<Integer> {
            @ParentCommand
            UserCommand parent;

            @Parameters(index = "0", description = "Instance name")
            String name;

            @Parameters(index = "1", description = "Username")
            String username;

            @Override
            public Integer call() {
                parent.parent.withManager(m -> m.removeUser(name, username).join());
                parent.spec.commandLine().getOut().println("Removed " + username + " from " + name);
                parent.spec.commandLine().getOut().flush();
                return 0;
            }
        }

        @Command(name = "list", description = "List usernames")
        static final class ListUsersCommand implements Callable<Integer> {
            @ParentCommand
            UserCommand parent;

            @Parameters(index = "0", description = "Instance name")
            String name;

            @Override
            public Integer call() {
                parent.parent.printJson(parent.parent.withManager(m -> m.listUsers(name)));
                return 0;
            }
        }
    }

    // ==================== Certificates ====================

    @Command(
            name = "cert",
            description = "Inspect or replace an instance certificate",
            subcommands = {
                    CertCommand.InfoCertCommand.class,
                    CertCommand.RegenerateCommand.class
            }
    )
    static final class CertCommand implements Runnable {
        @ParentCommand
        FleetCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public void run() {
            spec.commandLine().usage(spec.commandLine().getOut());
        }

        @Command(name = "info", description = "Show certificate details")
        static final class InfoCertCommand implements Callable<Integer> {
            @ParentCommand
            CertCommand parent;

            @Parameters(index = "0", description = "Instance name")
            String name;

            @Override
            public Integer call() {
                CertificateDetails details = parent.parent.withManager(m -> m.getCertificate(name));
                if (details == null) {
                    throw new NotFoundException("Instance '" + name + "' has no certificate");
                }
                parent.parent.printJson(details);
                return 0;
            }
        }

        @Command(name = "regenerate", description = "Generate a new certificate")
        static final class RegenerateCommand implements Callable<Integer> {
            @ParentCommand
            CertCommand parent;

            @Parameters(index = "0", description = "Instance name")
            String name;

            @Option(names = {"--cn"}, description = "Certificate common name")
            String commonName;

            @Option(names = {"--days"}, description = "Validity in days")
            Integer validityDays;

            @Option(names = {"--key-size"}, description = "RSA key size")
            Integer keySize;

            @Override
            public Integer call() {
                CertificateParams params = certificateParams(commonName, validityDays, keySize);
                parent.parent.printJson(parent.parent.withManager(
                        m -> m.regenerateCertificate(name, params).join()));
                return 0;
            }
        }
    }
}
