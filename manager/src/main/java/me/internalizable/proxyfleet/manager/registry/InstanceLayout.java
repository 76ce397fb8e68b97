package me.internalizable.proxyfleet.manager.registry;

import me.internalizable.proxyfleet.api.ProxyType;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

/**
 * On-disk layout of one instance.
 *
 * <pre>
 * &lt;data&gt;/&lt;name&gt;/
 * ├── instance.json        # metadata record
 * ├── squid.conf | nginx.conf
 * ├── passwd               # basic-auth credentials
 * ├── certs/
 * │   ├── server.crt
 * │   └── server.key
 * ├── cover_site/          # TLS tunnels with a cover domain
 * │   └── index.html
 * └── logs/
 *     └── daemon.log
 * </pre>
 */
public final class InstanceLayout {

    public static final String RECORD_FILE = "instance.json";
    public static final String FORWARD_PROXY_CONFIG = "squid.conf";
    public static final String TLS_TUNNEL_CONFIG = "nginx.conf";
    public static final String CREDENTIALS_FILE = "passwd";
    public static final String DAEMON_LOG = "daemon.log";

    private final String name;
    private final Path directory;

    private InstanceLayout(String name, Path directory) {
        this.name = name;
        this.directory = directory;
    }

    /**
     * Resolve the layout of an instance.
     *
     * @param dataDirectory fleet data directory
     * @param name instance name, validated
     * @return the layout
     */
    @Nonnull
    public static InstanceLayout of(@Nonnull Path dataDirectory, @Nonnull String name) {
        Objects.requireNonNull(dataDirectory, "dataDirectory");
        return new InstanceLayout(name, InstanceNames.resolve(dataDirectory, name));
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public Path getDirectory() {
        return directory;
    }

    @Nonnull
    public Path getRecordFile() {
        return directory.resolve(RECORD_FILE);
    }

    /**
     * Get the daemon configuration file for a proxy type.
     *
     * @param type proxy type
     * @return config file path
     */
    @Nonnull
    public Path getConfigFile(@Nonnull ProxyType type) {
        return directory.resolve(type == ProxyType.TLS_TUNNEL ? TLS_TUNNEL_CONFIG : FORWARD_PROXY_CONFIG);
    }

    @Nonnull
    public Path getCredentialsFile() {
        return directory.resolve(CREDENTIALS_FILE);
    }

    @Nonnull
    public Path getCertificateDirectory() {
        return directory.resolve("certs");
    }

    @Nonnull
    public Path getCertificateFile() {
        return getCertificateDirectory().resolve("server.crt");
    }

    @Nonnull
    public Path getKeyFile() {
        return getCertificateDirectory().resolve("server.key");
    }

    @Nonnull
    public Path getCoverSiteDirectory() {
        return directory.resolve("cover_site");
    }

    @Nonnull
    public Path getLogsDirectory() {
        return directory.resolve("logs");
    }

    @Nonnull
    public Path getDaemonLog() {
        return getLogsDirectory().resolve(DAEMON_LOG);
    }

    /**
     * Get the PID file the daemon is told to write.
     *
     * @param type proxy type
     * @return pid file path
     */
    @Nonnull
    public Path getPidFile(@Nonnull ProxyType type) {
        return directory.resolve(type == ProxyType.TLS_TUNNEL ? "nginx.pid" : "squid.pid");
    }

    @Override
    public String toString() {
        return "InstanceLayout{" + name + " -> " + directory + '}';
    }
}
