package me.internalizable.proxyfleet.manager.security;

import me.internalizable.proxyfleet.api.CertificateDetails;
import me.internalizable.proxyfleet.api.CertificateParams;
import me.internalizable.proxyfleet.api.error.CertificateFailureException;
import me.internalizable.proxyfleet.manager.registry.AtomicFiles;
import me.internalizable.proxyfleet.manager.registry.InstanceLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class CertificateManagerTest {

    @TempDir
    Path dataDir;

    private CertificateManager certificateManager;
    private InstanceLayout layout;

    @BeforeEach
    void setUp() throws Exception {
        certificateManager = new CertificateManager(new ArtifactPermissions(null));
        layout = InstanceLayout.of(dataDir, "office");
        Files.createDirectories(layout.getDirectory());
    }

    private X509Certificate parse(Path file) throws Exception {
        try (InputStream in = Files.newInputStream(file)) {
            return (X509Certificate) CertificateFactory.getInstance("X.509").generateCertificate(in);
        }
    }

    @Test
    void generatesServerCertificate() throws Exception {
        CertificateDetails details = certificateManager.generate(layout,
                CertificateParams.forCommonName("proxy.example.com").withValidityDays(30));

        assertThat(certificateManager.exists(layout)).isTrue();
        assertThat(details.commonName()).isEqualTo("proxy.example.com");
        assertThat(details.keySize()).isEqualTo(2048);
        assertThat(details.isValidAt(Instant.now())).isTrue();
        assertThat(details.notAfter()).isBetween(
                Instant.now().plus(Duration.ofDays(29)), Instant.now().plus(Duration.ofDays(31)));
        assertThat(details.sha256Fingerprint()).matches("([0-9A-F]{2}:){31}[0-9A-F]{2}");

        X509Certificate certificate = parse(layout.getCertificateFile());
        assertThat(certificate.getSubjectX500Principal().getName()).contains("CN=proxy.example.com");
        assertThat(certificate.getBasicConstraints()).isEqualTo(-1);
        assertThat(certificate.getExtendedKeyUsage()).contains("1.3.6.1.5.5.7.3.1");
        assertThat(certificate.getSubjectAlternativeNames())
                .anySatisfy(entry -> assertThat(entry).isEqualTo(List.of(2, "proxy.example.com")));
        assertThat(Files.readString(layout.getKeyFile())).contains("PRIVATE KEY");
    }

    @Test
    void infoMatchesGeneratedCertificate() {
        CertificateDetails generated = certificateManager.generate(layout,
                CertificateParams.forCommonName("10.0.0.1").withKeySize(3072));

        CertificateDetails info = certificateManager.info(layout);

        assertThat(info).isNotNull();
        assertThat(info.commonName()).isEqualTo("10.0.0.1");
        assertThat(info.keySize()).isEqualTo(3072);
        assertThat(info.serialNumber()).isEqualTo(generated.serialNumber());
        assertThat(info.sha256Fingerprint()).isEqualTo(generated.sha256Fingerprint());
    }

    @Test
    void regenerationReplacesCertificate() {
        CertificateDetails first = certificateManager.generate(layout, CertificateParams.forCommonName("a.example"));
        CertificateDetails second = certificateManager.generate(layout, CertificateParams.forCommonName("b.example"));

        assertThat(second.sha256Fingerprint()).isNotEqualTo(first.sha256Fingerprint());
        assertThat(certificateManager.info(layout).commonName()).isEqualTo("b.example");
    }

    @Test
    void infoIsNullWithoutCertificate() {
        assertThat(certificateManager.exists(layout)).isFalse();
        assertThat(certificateManager.info(layout)).isNull();
    }

    @Test
    void filesAreNotWorldReadable() throws Exception {
        assumeTrue(AtomicFiles.isPosix());
        certificateManager.generate(layout, CertificateParams.forCommonName("proxy.example.com"));

        Set<PosixFilePermission> keyPermissions = Files.getPosixFilePermissions(layout.getKeyFile());
        assertThat(keyPermissions).doesNotContain(
                PosixFilePermission.OTHERS_READ, PosixFilePermission.OTHERS_WRITE);
        assertThat(ArtifactPermissions.isWorldWritable(layout.getCertificateDirectory())).isFalse();
    }

    @Test
    void refusesWorldWritableInstanceDirectory() throws Exception {
        assumeTrue(AtomicFiles.isPosix());
        Files.setPosixFilePermissions(layout.getDirectory(), PosixFilePermissions.fromString("rwxrwxrwx"));

        assertThatThrownBy(() -> certificateManager.generate(layout,
                CertificateParams.forCommonName("proxy.example.com")))
                .isInstanceOf(CertificateFailureException.class)
                .hasMessageContaining("world-writable");
        assertThat(certificateManager.exists(layout)).isFalse();
    }

    @Test
    void corruptCertificateIsReported() throws Exception {
        Files.createDirectories(layout.getCertificateDirectory());
        Files.writeString(layout.getCertificateFile(), "not a certificate");

        assertThatThrownBy(() -> certificateManager.info(layout))
                .isInstanceOf(CertificateFailureException.class);
    }

    @Test
    void outOfRangeAddressBecomesDnsName() throws Exception {
        CertificateDetails details = certificateManager.generate(layout, CertificateParams.forCommonName("300.1.1.1"));

        assertThat(details.commonName()).isEqualTo("300.1.1.1");
        assertThat(parse(layout.getCertificateFile()).getSubjectAlternativeNames())
                .anySatisfy(entry -> assertThat(entry).isEqualTo(List.of(2, "300.1.1.1")));
    }
}
