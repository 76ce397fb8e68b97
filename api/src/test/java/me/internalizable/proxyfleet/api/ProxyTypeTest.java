package me.internalizable.proxyfleet.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProxyTypeTest {

    @Test
    void parsesWireAndConstantNames() {
        assertThat(ProxyType.fromWireName("forward_proxy")).isEqualTo(ProxyType.FORWARD_PROXY);
        assertThat(ProxyType.fromWireName("TLS_TUNNEL")).isEqualTo(ProxyType.TLS_TUNNEL);
        assertThat(ProxyType.TLS_TUNNEL.toString()).isEqualTo("tls_tunnel");
    }

    @Test
    void rejectsUnknownNames() {
        assertThatThrownBy(() -> ProxyType.fromWireName("socks"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("socks");
    }

    @Test
    void certificateDefaultsLeaveCommonNameOpen() {
        CertificateParams params = CertificateParams.defaults();

        assertThat(params.commonName()).isNull();
        assertThat(params.validityDays()).isEqualTo(CertificateParams.DEFAULT_VALIDITY_DAYS);
        assertThat(params.keySize()).isEqualTo(2048);
        assertThat(params.withKeySize(4096).commonName()).isNull();
    }
}
