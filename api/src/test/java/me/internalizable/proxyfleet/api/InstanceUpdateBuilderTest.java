package me.internalizable.proxyfleet.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InstanceUpdateBuilderTest {

    @Test
    void emptyBuilderProducesEmptyUpdate() {
        InstanceUpdate update = InstanceUpdate.builder().build();

        assertThat(update.isEmpty()).isTrue();
        assertThat(update.getPort()).isNull();
        assertThat(update.getHttpsEnabled()).isNull();
        assertThat(update.isClearCoverDomain()).isFalse();
    }

    @Test
    void setFieldsAreReported() {
        InstanceUpdate update = InstanceUpdate.builder()
                .port(8443)
                .httpsEnabled(true)
                .certificate(CertificateParams.forCommonName("proxy.example.com"))
                .build();

        assertThat(update.isEmpty()).isFalse();
        assertThat(update.getPort()).isEqualTo(8443);
        assertThat(update.getHttpsEnabled()).isTrue();
        assertThat(update.getDpiEvasionEnabled()).isNull();
        assertThat(update.getCertificate().commonName()).isEqualTo("proxy.example.com");
    }

    @Test
    void clearingCoverDomainOverridesEarlierValue() {
        InstanceUpdate update = InstanceUpdate.builder()
                .coverDomain("www.example.com")
                .clearCoverDomain()
                .build();

        assertThat(update.getCoverDomain()).isNull();
        assertThat(update.isClearCoverDomain()).isTrue();
        assertThat(update.isEmpty()).isFalse();
    }

    @Test
    void settingCoverDomainCancelsClear() {
        InstanceUpdate update = InstanceUpdate.builder()
                .clearCoverDomain()
                .coverDomain("www.example.com")
                .build();

        assertThat(update.getCoverDomain()).isEqualTo("www.example.com");
        assertThat(update.isClearCoverDomain()).isFalse();
    }
}
