package me.internalizable.proxyfleet.manager.config;

import me.internalizable.proxyfleet.api.CertificateParams;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the fleet manager.
 *
 * <p>Loaded from {@code manager.yml}. Defines where instance data lives,
 * which daemon binaries back each proxy type, supervision timeouts and
 * certificate defaults.</p>
 *
 * <p>Daemon argument lists may contain the placeholders {@code {config}},
 * {@code {name}}, {@code {port}}, {@code {dir}} and {@code {logs}}, which are
 * substituted per instance at spawn time.</p>
 */
public class FleetConfig {

    private String dataDirectory = "/var/lib/proxyfleet";
    private String daemonUser = "proxy";
    private String daemonGroup = "proxy";
    private boolean requireAuthentication = true;
    private int healthCheckIntervalSeconds = 5;
    private int processStartTimeoutSeconds = 10;
    private int processStopTimeoutSeconds = 5;
    private PortAllocationConfig portAllocation = new PortAllocationConfig();
    private DaemonConfig forwardProxy = new DaemonConfig();
    private DaemonConfig tlsTunnel = new DaemonConfig();
    private CertificateConfig certificates = new CertificateConfig();

    public FleetConfig() {
        forwardProxy.setBinary("/usr/sbin/squid");
        forwardProxy.setArguments(new ArrayList<>(List.of("-N", "-f", "{config}")));
        forwardProxy.setAuthHelper("/usr/lib/squid/basic_ncsa_auth");

        tlsTunnel.setBinary("/usr/sbin/nginx");
        tlsTunnel.setArguments(new ArrayList<>(List.of(
                "-p", "{dir}", "-e", "{logs}/error.log", "-c", "{config}")));
        tlsTunnel.setModulePath("/usr/lib/nginx/modules/ngx_stream_module.so");
    }

    /**
     * Load configuration from file, creating default if not exists.
     *
     * @param path path to config file
     * @return loaded configuration
     * @throws IOException if loading fails
     */
    @Nonnull
    public static FleetConfig load(@Nonnull Path path) throws IOException {
        if (!Files.exists(path)) {
            FleetConfig config = new FleetConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(FleetConfig.class, options));
        try (InputStream is = Files.newInputStream(path)) {
            FleetConfig config = yaml.load(is);
            return config != null ? config : new FleetConfig();
        }
    }

    /**
     * Save configuration to file.
     *
     * @param path path to save to
     * @throws IOException if saving fails
     */
    public void save(@Nonnull Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Representer representer = new Representer(options);
        // Plain map at the root so the loader needs no global tag
        representer.addClassTag(FleetConfig.class, Tag.MAP);

        Yaml yaml = new Yaml(representer, options);
        try (Writer writer = Files.newBufferedWriter(path)) {
            yaml.dump(this, writer);
        }
    }

    /**
     * Resolve the data directory as an absolute path.
     *
     * @return data directory
     */
    @Nonnull
    public Path resolveDataDirectory() {
        return Paths.get(dataDirectory).toAbsolutePath().normalize();
    }

    /**
     * Build default certificate parameters from this configuration.
     *
     * @param commonName subject CN, or null to leave it to the instance
     * @return certificate parameters
     */
    @Nonnull
    public CertificateParams defaultCertificateParams(@Nullable String commonName) {
        return new CertificateParams(commonName, certificates.getValidityDays(), certificates.getKeySize(),
                certificates.getOrganization(), certificates.getCountry());
    }

    // Getters and Setters

    public String getDataDirectory() {
        return dataDirectory;
    }

    public void setDataDirectory(String dataDirectory) {
        this.dataDirectory = dataDirectory;
    }

    public String getDaemonUser() {
        return daemonUser;
    }

    public void setDaemonUser(String daemonUser) {
        this.daemonUser = daemonUser;
    }

    public String getDaemonGroup() {
        return daemonGroup;
    }

    public void setDaemonGroup(String daemonGroup) {
        this.daemonGroup = daemonGroup;
    }

    public boolean isRequireAuthentication() {
        return requireAuthentication;
    }

    public void setRequireAuthentication(boolean requireAuthentication) {
        this.requireAuthentication = requireAuthentication;
    }

    public int getHealthCheckIntervalSeconds() {
        return healthCheckIntervalSeconds;
    }

    public void setHealthCheckIntervalSeconds(int healthCheckIntervalSeconds) {
        this.healthCheckIntervalSeconds = healthCheckIntervalSeconds;
    }

    public int getProcessStartTimeoutSeconds() {
        return processStartTimeoutSeconds;
    }

    public void setProcessStartTimeoutSeconds(int processStartTimeoutSeconds) {
        this.processStartTimeoutSeconds = processStartTimeoutSeconds;
    }

    public int getProcessStopTimeoutSeconds() {
        return processStopTimeoutSeconds;
    }

    public void setProcessStopTimeoutSeconds(int processStopTimeoutSeconds) {
        this.processStopTimeoutSeconds = processStopTimeoutSeconds;
    }

    public PortAllocationConfig getPortAllocation() {
        return portAllocation;
    }

    public void setPortAllocation(PortAllocationConfig portAllocation) {
        this.portAllocation = portAllocation;
    }

    public DaemonConfig getForwardProxy() {
        return forwardProxy;
    }

    public void setForwardProxy(DaemonConfig forwardProxy) {
        this.forwardProxy = forwardProxy;
    }

    public DaemonConfig getTlsTunnel() {
        return tlsTunnel;
    }

    public void setTlsTunnel(DaemonConfig tlsTunnel) {
        this.tlsTunnel = tlsTunnel;
    }

    public CertificateConfig getCertificates() {
        return certificates;
    }

    public void setCertificates(CertificateConfig certificates) {
        this.certificates = certificates;
    }

    /**
     * Configuration for one daemon kind.
     */
    public static class DaemonConfig {
        private String binary;
        private List<String> arguments = new ArrayList<>();
        private Map<String, String> environment = new HashMap<>();
        private String authHelper;
        private String modulePath;
        private String workerProcesses = "auto";

        public String getBinary() {
            return binary;
        }

        public void setBinary(String binary) {
            this.binary = binary;
        }

        public List<String> getArguments() {
            return arguments;
        }

        public void setArguments(List<String> arguments) {
            this.arguments = arguments;
        }

        public Map<String, String> getEnvironment() {
            return environment;
        }

        public void setEnvironment(Map<String, String> environment) {
            this.environment = environment;
        }

        /**
         * Basic-auth helper program (forward proxy).
         */
        public String getAuthHelper() {
            return authHelper;
        }

        public void setAuthHelper(String authHelper) {
            this.authHelper = authHelper;
        }

        /**
         * Dynamic stream module to load (TLS tunnel); empty when built in.
         */
        public String getModulePath() {
            return modulePath;
        }

        public void setModulePath(String modulePath) {
            this.modulePath = modulePath;
        }

        public String getWorkerProcesses() {
            return workerProcesses;
        }

        public void setWorkerProcesses(String workerProcesses) {
            this.workerProcesses = workerProcesses;
        }
    }

    /**
     * Configuration for the legal port range.
     */
    public static class PortAllocationConfig {
        private int rangeStart = 1024;
        private int rangeEnd = 65535;

        public int getRangeStart() {
            return rangeStart;
        }

        public void setRangeStart(int rangeStart) {
            this.rangeStart = rangeStart;
        }

        public int getRangeEnd() {
            return rangeEnd;
        }

        public void setRangeEnd(int rangeEnd) {
            this.rangeEnd = rangeEnd;
        }
    }

    /**
     * Defaults for generated certificates.
     */
    public static class CertificateConfig {
        private int validityDays = CertificateParams.DEFAULT_VALIDITY_DAYS;
        private int keySize = CertificateParams.DEFAULT_KEY_SIZE;
        private String organization = CertificateParams.DEFAULT_ORGANIZATION;
        private String country = CertificateParams.DEFAULT_COUNTRY;
        private String defaultCommonName = "localhost";

        public int getValidityDays() {
            return validityDays;
        }

        public void setValidityDays(int validityDays) {
            this.validityDays = validityDays;
        }

        public int getKeySize() {
            return keySize;
        }

        public void setKeySize(int keySize) {
            this.keySize = keySize;
        }

        public String getOrganization() {
            return organization;
        }

        public void setOrganization(String organization) {
            this.organization = organization;
        }

        public String getCountry() {
            return country;
        }

        public void setCountry(String country) {
            this.country = country;
        }

        public String getDefaultCommonName() {
            return defaultCommonName;
        }

        public void setDefaultCommonName(String defaultCommonName) {
            this.defaultCommonName = defaultCommonName;
        }
    }
}
