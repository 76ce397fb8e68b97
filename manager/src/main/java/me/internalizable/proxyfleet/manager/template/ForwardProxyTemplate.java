package me.internalizable.proxyfleet.manager.template;

import me.internalizable.proxyfleet.api.error.ValidationException;
import me.internalizable.proxyfleet.manager.config.FleetConfig;
import me.internalizable.proxyfleet.manager.registry.InstanceLayout;
import me.internalizable.proxyfleet.manager.registry.InstanceRecord;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Squid configuration for forward-proxy instances.
 *
 * <p>TLS, when enabled, only terminates client connections on the listening
 * port. No ssl_bump directive is ever emitted, so upstream traffic is never
 * intercepted or decrypted.</p>
 */
public class ForwardProxyTemplate implements DaemonTemplate {

    /**
     * Response headers that identify the proxy, stripped when DPI evasion is on.
     */
    static final List<String> IDENTIFYING_HEADERS = List.of(
            "Via", "X-Cache", "X-Cache-Lookup", "X-Squid-Error", "Server");

    private final FleetConfig.DaemonConfig daemon;
    private final String daemonUser;
    private final boolean requireAuthentication;

    /**
     * Create the template.
     *
     * @param daemon squid settings
     * @param daemonUser effective user for squid, or null to keep the spawning user
     * @param requireAuthentication whether clients must authenticate
     */
    public ForwardProxyTemplate(
            @Nonnull FleetConfig.DaemonConfig daemon,
            @Nullable String daemonUser,
            boolean requireAuthentication) {
        this.daemon = Objects.requireNonNull(daemon, "daemon");
        this.daemonUser = daemonUser == null || daemonUser.isBlank() ? null : daemonUser;
        this.requireAuthentication = requireAuthentication;
    }

    @Override
    @Nonnull
    public String render(@Nonnull InstanceRecord record, @Nonnull InstanceLayout layout) {
        StringBuilder out = new StringBuilder(2048);
        out.append("# Squid configuration for instance ").append(record.name()).append('\n');
        out.append("# Generated by proxyfleet; manual changes are overwritten\n\n");

        appendListener(out, record, layout);
        appendRuntime(out, record, layout);
        appendAccess(out, record, layout);
        appendHardening(out);
        if (record.dpiEvasionEnabled()) {
            appendDpiEvasion(out);
        }
        return out.toString();
    }

    private void appendListener(StringBuilder out, InstanceRecord record, InstanceLayout layout) {
        if (record.httpsEnabled()) {
            out.append("https_port ").append(record.port())
                    .append(" tls-cert=").append(layout.getCertificateFile())
                    .append(" tls-key=").append(layout.getKeyFile());
            if (record.dpiEvasionEnabled()) {
                out.append(" tls-min-version=1.2");
            }
            out.append('\n');
        } else {
            out.append("http_port ").append(record.port()).append('\n');
        }
        out.append('\n');
    }

    private void appendRuntime(StringBuilder out, InstanceRecord record, InstanceLayout layout) {
        out.append("pid_filename ").append(layout.getPidFile(record.proxyType())).append('\n');
        out.append("access_log stdio:").append(layout.getLogsDirectory().resolve("access.log")).append('\n');
        out.append("cache_log ").append(layout.getLogsDirectory().resolve("cache.log")).append('\n');
        out.append("cache_store_log none\n");
        out.append("coredump_dir ").append(layout.getDirectory()).append('\n');
        out.append("visible_hostname ").append(record.name()).append('\n');
        if (daemonUser != null) {
            out.append("cache_effective_user ").append(daemonUser).append('\n');
        }
        out.append('\n');
    }

    private void appendAccess(StringBuilder out, InstanceRecord record, InstanceLayout layout) {
        if (!requireAuthentication) {
            out.append("http_access allow all\n\n");
            return;
        }
        String helper = daemon.getAuthHelper();
        if (helper == null || helper.isBlank()) {
            throw new ValidationException("Authentication is required but no basic-auth helper is configured");
        }
        out.append("auth_param basic program ").append(helper).append(' ')
                .append(layout.getCredentialsFile()).append('\n');
        out.append("auth_param basic children 5\n");
        out.append("auth_param basic realm ").append(record.name()).append('\n');
        out.append("auth_param basic credentialsttl 2 hours\n");
        out.append("acl authenticated proxy_auth REQUIRED\n");
        out.append("http_access allow authenticated\n");
        out.append("http_access deny all\n\n");
    }

    private static void appendHardening(StringBuilder out) {
        out.append("via off\n");
        out.append("forwarded_for delete\n");
        out.append("request_header_access X-Forwarded-For deny all\n");
        out.append("cache deny all\n");
    }

    private static void appendDpiEvasion(StringBuilder out) {
        out.append('\n');
        out.append("httpd_suppress_version_string on\n");
        for (String header : IDENTIFYING_HEADERS) {
            out.append("reply_header_access ").append(header).append(" deny all\n");
        }
        out.append("request_header_access Via deny all\n");
        out.append("tls_outgoing_options min-version=1.2\n");
    }
}
