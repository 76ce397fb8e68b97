package me.internalizable.proxyfleet.manager.template;

import me.internalizable.proxyfleet.api.ProxyType;
import me.internalizable.proxyfleet.api.error.ValidationException;
import me.internalizable.proxyfleet.manager.config.FleetConfig;
import me.internalizable.proxyfleet.manager.registry.InstanceLayout;
import me.internalizable.proxyfleet.manager.registry.InstanceRecord;
import me.internalizable.proxyfleet.manager.testing.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigGeneratorTest {

    @TempDir
    Path dataDir;

    private FleetConfig config;
    private ConfigGenerator generator;

    @BeforeEach
    void setUp() {
        config = new FleetConfig();
        config.setDataDirectory(dataDir.toString());
        generator = new ConfigGenerator(config);
    }

    private GeneratedConfig render(InstanceRecord record) {
        return generator.generate(record, InstanceLayout.of(dataDir, record.name()));
    }

    // ==================== Forward proxy ====================

    @Test
    void plainForwardProxyRequiresAuthentication() {
        InstanceLayout layout = InstanceLayout.of(dataDir, "office");
        GeneratedConfig generated = render(TestRecords.forwardProxy("office", 3128));

        assertThat(generated.proxyType()).isEqualTo(ProxyType.FORWARD_PROXY);
        assertThat(generated.fileName()).isEqualTo("squid.conf");
        assertThat(generated.content())
                .contains("http_port 3128\n")
                .contains("auth_param basic program /usr/lib/squid/basic_ncsa_auth " + layout.getCredentialsFile())
                .contains("acl authenticated proxy_auth REQUIRED")
                .contains("http_access allow authenticated\nhttp_access deny all")
                .contains("cache_effective_user proxy")
                .contains("forwarded_for delete")
                .doesNotContain("https_port")
                .doesNotContain("tls-cert")
                .doesNotContain("httpd_suppress_version_string");
    }

    @Test
    void httpsListenerReferencesCertificateFiles() {
        InstanceLayout layout = InstanceLayout.of(dataDir, "office");
        InstanceRecord record = TestRecords.forwardProxy("office", 3128).withHttpsEnabled(true);

        String content = render(record).content();

        assertThat(content)
                .contains("https_port 3128 tls-cert=" + layout.getCertificateFile()
                        + " tls-key=" + layout.getKeyFile() + "\n")
                .doesNotContain("http_port 3128");
    }

    @Test
    void dpiEvasionStripsIdentifyingHeaders() {
        InstanceRecord record = TestRecords.forwardProxy("office", 3128)
                .withHttpsEnabled(true)
                .withDpiEvasionEnabled(true);

        String content = render(record).content();

        assertThat(content)
                .contains("tls-min-version=1.2")
                .contains("httpd_suppress_version_string on")
                .contains("reply_header_access Via deny all")
                .contains("reply_header_access X-Cache deny all")
                .contains("reply_header_access Server deny all")
                .contains("via off");
    }

    @Test
    void openProxyWhenAuthenticationDisabled() {
        config.setRequireAuthentication(false);
        generator = new ConfigGenerator(config);

        String content = render(TestRecords.forwardProxy("lab", 3128)).content();

        assertThat(content).contains("http_access allow all").doesNotContain("auth_param");
    }

    @Test
    void missingAuthHelperIsRejected() {
        config.getForwardProxy().setAuthHelper(" ");
        generator = new ConfigGenerator(config);

        assertThatThrownBy(() -> render(TestRecords.forwardProxy("office", 3128)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void renderingIsDeterministic() {
        InstanceRecord record = TestRecords.forwardProxy("office", 3128).withDpiEvasionEnabled(true);

        assertThat(render(record)).isEqualTo(render(record));
        assertThat(render(record).toBytes()).isEqualTo(render(record).toBytes());
    }

    // ==================== TLS tunnel ====================

    @Test
    void tunnelWithCoverRoutesBySni() {
        InstanceLayout layout = InstanceLayout.of(dataDir, "vpn-front");
        InstanceRecord record = TestRecords.tlsTunnel("vpn-front", 8443, "127.0.0.1:1194", "www.example.com");

        GeneratedConfig generated = render(record);
        String content = generated.content();

        assertThat(generated.fileName()).isEqualTo("nginx.conf");
        assertThat(content)
                .contains("load_module /usr/lib/nginx/modules/ngx_stream_module.so;")
                .contains("daemon off;")
                .contains("map $ssl_preread_server_name $backend_vpn_front {")
                .contains("www.example.com 127.0.0.1:18443;")
                .contains("default 127.0.0.1:1194;")
                .contains("listen 8443;")
                .contains("ssl_preread on;")
                .contains("proxy_pass $backend_vpn_front;")
                .contains("listen 127.0.0.1:18443 ssl;")
                .contains("server_name www.example.com;")
                .contains("ssl_certificate " + layout.getCertificateFile() + ";")
                .contains("root " + layout.getCoverSiteDirectory() + ";");
    }

    @Test
    void tunnelWithoutCoverHasNoHttpBlock() {
        InstanceRecord record = TestRecords.tlsTunnel("relay", 9443, "10.0.0.5:443", null);

        String content = render(record).content();

        assertThat(content)
                .contains("default 10.0.0.5:443;")
                .doesNotContain("http {")
                .doesNotContain("ssl_certificate")
                .doesNotContain("127.0.0.1:19443");
    }

    @Test
    void backendVariableIsSanitized() {
        assertThat(TlsTunnelTemplate.backendVariable("eu.front-1")).isEqualTo("backend_eu_front_1");
    }
}
