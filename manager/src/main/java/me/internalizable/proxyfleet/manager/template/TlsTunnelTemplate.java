package me.internalizable.proxyfleet.manager.template;

import me.internalizable.proxyfleet.manager.config.FleetConfig;
import me.internalizable.proxyfleet.manager.registry.InstanceLayout;
import me.internalizable.proxyfleet.manager.registry.InstanceRecord;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * nginx configuration for TLS-tunnel instances.
 *
 * <p>The stream block reads the SNI of each incoming TLS connection without
 * terminating it. Connections naming the cover domain go to a loopback HTTPS
 * server that serves the cover site; everything else is passed through to the
 * instance's forward address. Without a cover domain there is only the
 * default route and no http block.</p>
 */
public class TlsTunnelTemplate implements DaemonTemplate {

    private final FleetConfig.DaemonConfig daemon;
    private final String daemonUser;

    /**
     * Create the template.
     *
     * @param daemon nginx settings
     * @param daemonUser worker user for nginx, or null to keep the spawning user
     */
    public TlsTunnelTemplate(@Nonnull FleetConfig.DaemonConfig daemon, @Nullable String daemonUser) {
        this.daemon = Objects.requireNonNull(daemon, "daemon");
        this.daemonUser = daemonUser == null || daemonUser.isBlank() ? null : daemonUser;
    }

    /**
     * Derive the nginx variable holding an instance's backend.
     *
     * @param name instance name
     * @return variable name without the leading {@code $}
     */
    @Nonnull
    public static String backendVariable(@Nonnull String name) {
        return "backend_" + name.replaceAll("[^A-Za-z0-9]", "_");
    }

    @Override
    @Nonnull
    public String render(@Nonnull InstanceRecord record, @Nonnull InstanceLayout layout) {
        String backend = backendVariable(record.name());
        StringBuilder out = new StringBuilder(2048);

        out.append("# nginx configuration for instance ").append(record.name()).append('\n');
        out.append("# Generated by proxyfleet; manual changes are overwritten\n\n");

        String modulePath = daemon.getModulePath();
        if (modulePath != null && !modulePath.isBlank()) {
            out.append("load_module ").append(modulePath).append(";\n\n");
        }

        out.append("daemon off;\n");
        out.append("pid ").append(layout.getPidFile(record.proxyType())).append(";\n");
        out.append("worker_processes ").append(workerProcesses()).append(";\n");
        if (daemonUser != null) {
            out.append("user ").append(daemonUser).append(";\n");
        }
        out.append("error_log ").append(layout.getLogsDirectory().resolve("error.log")).append(" warn;\n\n");

        out.append("events {\n");
        out.append("    worker_connections 1024;\n");
        out.append("}\n\n");

        out.append("stream {\n");
        out.append("    map $ssl_preread_server_name $").append(backend).append(" {\n");
        if (record.hasCoverSite()) {
            out.append("        ").append(record.coverDomain())
                    .append(" 127.0.0.1:").append(record.coverPort()).append(";\n");
        }
        out.append("        default ").append(record.forwardAddress()).append(";\n");
        out.append("    }\n\n");
        out.append("    server {\n");
        out.append("        listen ").append(record.port()).append(";\n");
        out.append("        ssl_preread on;\n");
        out.append("        proxy_pass $").append(backend).append(";\n");
        out.append("        proxy_connect_timeout 5s;\n");
        out.append("        proxy_timeout 86400s;\n");
        out.append("    }\n");
        out.append("}\n");

        if (record.hasCoverSite()) {
            appendCoverSite(out, record, layout);
        }
        return out.toString();
    }

    private static void appendCoverSite(StringBuilder out, InstanceRecord record, InstanceLayout layout) {
        out.append('\n');
        out.append("http {\n");
        out.append("    server_tokens off;\n");
        out.append("    access_log off;\n\n");
        out.append("    server {\n");
        out.append("        listen 127.0.0.1:").append(record.coverPort()).append(" ssl;\n");
        out.append("        server_name ").append(record.coverDomain()).append(";\n\n");
        out.append("        ssl_certificate ").append(layout.getCertificateFile()).append(";\n");
        out.append("        ssl_certificate_key ").append(layout.getKeyFile()).append(";\n");
        out.append("        ssl_protocols TLSv1.2 TLSv1.3;\n\n");
        out.append("        root ").append(layout.getCoverSiteDirectory()).append(";\n");
        out.append("        index index.html;\n\n");
        out.append("        location / {\n");
        out.append("            try_files $uri $uri/ =404;\n");
        out.append("        }\n");
        out.append("    }\n");
        out.append("}\n");
    }

    private String workerProcesses() {
        String workers = daemon.getWorkerProcesses();
        return workers == null || workers.isBlank() ? "auto" : workers;
    }
}
