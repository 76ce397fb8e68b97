package me.internalizable.proxyfleet.manager.instance;

import me.internalizable.proxyfleet.api.CertificateParams;
import me.internalizable.proxyfleet.api.InstanceSpec;
import me.internalizable.proxyfleet.api.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstanceValidatorTest {

    @Test
    void acceptsWellFormedSpecs() {
        assertThatCode(() -> InstanceValidator.validateSpec(InstanceSpec.forwardProxy("office", 3128)))
                .doesNotThrowAnyException();
        assertThatCode(() -> InstanceValidator.validateSpec(
                InstanceSpec.tlsTunnel("vpn-front", 8443, "127.0.0.1:1194", "www.example.com")))
                .doesNotThrowAnyException();
    }

    @Test
    void tunnelNeedsForwardAddress() {
        assertThatThrownBy(() -> InstanceValidator.validateSpec(
                new InstanceSpec.TlsTunnel("vpn-front", 8443, null, null, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("forward_address");
    }

    @Test
    void rejectsMalformedForwardAddresses() {
        assertThatThrownBy(() -> InstanceValidator.validateForwardAddress("no-port"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("expected host:port");
        assertThatThrownBy(() -> InstanceValidator.validateForwardAddress("host:abc"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> InstanceValidator.validateForwardAddress("bad host:80"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> InstanceValidator.validateForwardAddress("10.0.0.1:70000"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Port out of range");
    }

    @Test
    void rejectsMalformedCoverDomains() {
        assertThatThrownBy(() -> InstanceValidator.validateCoverDomain("exa mple.com"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> InstanceValidator.validateCoverDomain("-leading.example.com"))
                .isInstanceOf(ValidationException.class);
        assertThatCode(() -> InstanceValidator.validateCoverDomain("cdn-1.example.co.uk"))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsOutOfRangeAddresses() {
        assertThatThrownBy(() -> InstanceValidator.validateCoverDomain("999.1.1.1"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("999.1.1.1");
        assertThatThrownBy(() -> InstanceValidator.validateCertificateParams(
                CertificateParams.forCommonName("300.1.1.1")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> InstanceValidator.validateCertificateParams(
                CertificateParams.forCommonName("1.2.3.99999999999")))
                .isInstanceOf(ValidationException.class);
        assertThatCode(() -> InstanceValidator.validateCertificateParams(
                CertificateParams.forCommonName("255.255.255.255")))
                .doesNotThrowAnyException();
        assertThatCode(() -> InstanceValidator.validateCoverDomain("1.2.3.example.com"))
                .doesNotThrowAnyException();
    }

    @Test
    void certificateParamsAreBounded() {
        CertificateParams base = CertificateParams.forCommonName("proxy.example.com");

        assertThatCode(() -> InstanceValidator.validateCertificateParams(base)).doesNotThrowAnyException();
        assertThatThrownBy(() -> InstanceValidator.validateCertificateParams(base.withKeySize(1024)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("1024");
        assertThatThrownBy(() -> InstanceValidator.validateCertificateParams(base.withValidityDays(0)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> InstanceValidator.validateCertificateParams(base.withValidityDays(3651)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> InstanceValidator.validateCertificateParams(base.withCommonName("bad name")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> InstanceValidator.validateCertificateParams(
                new CertificateParams("proxy.example.com", 365, 2048, "Org", "USA")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void usernamesAndPasswords() {
        assertThatCode(() -> InstanceValidator.validateUsername("alice.smith-2")).doesNotThrowAnyException();
        assertThatThrownBy(() -> InstanceValidator.validateUsername("alice:admin"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> InstanceValidator.validateUsername("a".repeat(33)))
                .isInstanceOf(ValidationException.class);

        assertThatCode(() -> InstanceValidator.validatePassword("s3cret with spaces")).doesNotThrowAnyException();
        assertThatThrownBy(() -> InstanceValidator.validatePassword(""))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> InstanceValidator.validatePassword("line\nbreak"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> InstanceValidator.validatePassword("x".repeat(129)))
                .isInstanceOf(ValidationException.class);
    }
}
