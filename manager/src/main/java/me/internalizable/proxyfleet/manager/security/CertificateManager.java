package me.internalizable.proxyfleet.manager.security;

import me.internalizable.proxyfleet.api.CertificateDetails;
import me.internalizable.proxyfleet.api.CertificateParams;
import me.internalizable.proxyfleet.api.error.CertificateFailureException;
import me.internalizable.proxyfleet.manager.registry.AtomicFiles;
import me.internalizable.proxyfleet.manager.registry.InstanceLayout;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.security.Security;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Generates and inspects the self-signed server certificate of an instance.
 *
 * <p>Certificates are end-entity server certificates: basic constraints mark
 * them as not being a CA, key usage is limited to signatures and key
 * encipherment, and extended key usage is server authentication. The subject
 * alternative names cover the common name plus {@code localhost} and
 * {@code 127.0.0.1}.</p>
 *
 * <p>Key and certificate are written to temporary files in the certificate
 * directory and renamed into place, key first, so a crash never leaves a
 * truncated key or a certificate whose key is missing.</p>
 */
public class CertificateManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(CertificateManager.class);

    private static final String SIGNATURE_ALGORITHM = "SHA256WithRSA";
    private static final Pattern IPV4 = Pattern.compile(
            "^(25[0-5]|2[0-4]\\d|1?\\d?\\d)(\\.(25[0-5]|2[0-4]\\d|1?\\d?\\d)){3}$");

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private final ArtifactPermissions permissions;
    private final SecureRandom random = new SecureRandom();

    public CertificateManager(@Nonnull ArtifactPermissions permissions) {
        this.permissions = Objects.requireNonNull(permissions, "permissions");
    }

    // ==================== Generation ====================

    /**
     * Generate a new key pair and certificate, replacing any existing ones.
     *
     * @param layout instance layout
     * @param params certificate parameters; the common name must be resolved
     * @return details of the new certificate
     * @throws CertificateFailureException if generation or storage fails
     */
    @Nonnull
    public CertificateDetails generate(@Nonnull InstanceLayout layout, @Nonnull CertificateParams params) {
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(params, "params");
        String commonName = Objects.requireNonNull(params.commonName(), "commonName");

        Path certDir = layout.getCertificateDirectory();
        checkLocation(certDir);

        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(params.keySize(), random);
            KeyPair keyPair = generator.generateKeyPair();

            X509Certificate certificate;
            try {
                certificate = buildCertificate(keyPair, params, commonName);
            } catch (IllegalArgumentException | IllegalStateException e) {
                throw new CertificateFailureException("Failed to build certificate for '"
                        + layout.getName() + "': " + e.getMessage(), e);
            }

            permissions.createDirectories(certDir);
            writePem(layout.getKeyFile(), keyPair.getPrivate());
            writePem(layout.getCertificateFile(), certificate);

            LOGGER.info("Generated certificate for '{}' (CN={}, {} bits, {} days)",
                    layout.getName(), commonName, params.keySize(), params.validityDays());
            return toDetails(certificate, toPem(certificate));
        } catch (GeneralSecurityException | OperatorCreationException e) {
            throw new CertificateFailureException("Failed to generate certificate for '"
                    + layout.getName() + "': " + e.getMessage(), e);
        } catch (IOException e) {
            throw new CertificateFailureException("Failed to write certificate for '"
                    + layout.getName() + "': " + e.getMessage(), e);
        }
    }

    private X509Certificate buildCertificate(KeyPair keyPair, CertificateParams params, String commonName)
            throws GeneralSecurityException, OperatorCreationException, CertIOException {
        X500Name subject = new X500NameBuilder(BCStyle.INSTANCE)
                .addRDN(BCStyle.CN, commonName)
                .addRDN(BCStyle.O, params.organization())
                .addRDN(BCStyle.C, params.country().toUpperCase(Locale.ROOT))
                .build();

        Instant now = Instant.now();
        Date notBefore = Date.from(now.minus(Duration.ofMinutes(1)));
        Date notAfter = Date.from(now.plus(Duration.ofDays(params.validityDays())));
        BigInteger serial = new BigInteger(64, random).abs().add(BigInteger.ONE);

        JcaX509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                subject, serial, notBefore, notAfter, subject, keyPair.getPublic());

        JcaX509ExtensionUtils extensionUtils = new JcaX509ExtensionUtils();
        builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
        builder.addExtension(Extension.keyUsage, true,
                new KeyUsage(KeyUsage.digitalSignature | KeyUsage.keyEncipherment));
        builder.addExtension(Extension.extendedKeyUsage, false,
                new ExtendedKeyUsage(KeyPurposeId.id_kp_serverAuth));
        builder.addExtension(Extension.subjectAlternativeName, false, subjectAlternativeNames(commonName));
        builder.addExtension(Extension.subjectKeyIdentifier, false,
                extensionUtils.createSubjectKeyIdentifier(keyPair.getPublic()));

        ContentSigner signer = new JcaContentSignerBuilder(SIGNATURE_ALGORITHM)
                .build(keyPair.getPrivate());
        X509CertificateHolder holder = builder.build(signer);
        return new JcaX509CertificateConverter().getCertificate(holder);
    }

    private static GeneralNames subjectAlternativeNames(String commonName) {
        List<GeneralName> names = new ArrayList<>();
        names.add(new GeneralName(IPV4.matcher(commonName).matches()
                ? GeneralName.iPAddress : GeneralName.dNSName, commonName));
        if (!"localhost".equalsIgnoreCase(commonName)) {
            names.add(new GeneralName(GeneralName.dNSName, "localhost"));
        }
        if (!"127.0.0.1".equals(commonName)) {
            names.add(new GeneralName(GeneralName.iPAddress, "127.0.0.1"));
        }
        return new GeneralNames(names.toArray(new GeneralName[0]));
    }

    private void writePem(Path target, Object object) throws IOException {
        AtomicFiles.writeString(target, toPem(object), ArtifactPermissions.FILE);
        permissions.applyFile(target);
    }

    private static String toPem(Object object) throws IOException {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(object);
        }
        return out.toString();
    }

    /**
     * Refuse locations any local user could tamper with.
     */
    private void checkLocation(Path certDir) {
        try {
            Path instanceDir = certDir.getParent();
            for (Path dir : new Path[]{certDir, instanceDir, instanceDir.getParent()}) {
                if (dir != null && ArtifactPermissions.isWorldWritable(dir)) {
                    throw new CertificateFailureException("Refusing to write certificate: "
                            + dir + " is world-writable");
                }
            }
        } catch (IOException e) {
            throw new CertificateFailureException("Cannot inspect certificate directory "
                    + certDir + ": " + e.getMessage(), e);
        }
    }

    // ==================== Inspection ====================

    /**
     * Check whether both certificate and key exist.
     *
     * @param layout instance layout
     * @return true if both files exist
     */
    public boolean exists(@Nonnull InstanceLayout layout) {
        return Files.isRegularFile(layout.getCertificateFile()) && Files.isRegularFile(layout.getKeyFile());
    }

    /**
     * Parse the certificate of an instance.
     *
     * @param layout instance layout
     * @return certificate details, or null if the instance has no certificate
     * @throws CertificateFailureException if the file exists but cannot be parsed
     */
    @Nullable
    public CertificateDetails info(@Nonnull InstanceLayout layout) {
        Path certFile = layout.getCertificateFile();
        if (!Files.isRegularFile(certFile)) {
            return null;
        }
        try {
            String pem = Files.readString(certFile, StandardCharsets.US_ASCII);
            Object parsed;
            try (PEMParser parser = new PEMParser(new StringReader(pem))) {
                parsed = parser.readObject();
            }
            if (!(parsed instanceof X509CertificateHolder holder)) {
                throw new CertificateFailureException("No certificate found in " + certFile);
            }
            X509Certificate certificate = new JcaX509CertificateConverter().getCertificate(holder);
            return toDetails(certificate, pem);
        } catch (IOException | GeneralSecurityException e) {
            throw new CertificateFailureException("Failed to read certificate of '"
                    + layout.getName() + "': " + e.getMessage(), e);
        }
    }

    private static CertificateDetails toDetails(X509Certificate certificate, String pem)
            throws GeneralSecurityException {
        X500Name subject = X500Name.getInstance(certificate.getSubjectX500Principal().getEncoded());
        String commonName = subject.getRDNs(BCStyle.CN).length > 0
                ? subject.getRDNs(BCStyle.CN)[0].getFirst().getValue().toString()
                : "";
        int keySize = certificate.getPublicKey() instanceof RSAPublicKey rsa
                ? rsa.getModulus().bitLength()
                : -1;
        byte[] digest = MessageDigest.getInstance("SHA-256").digest(certificate.getEncoded());

        return new CertificateDetails(
                commonName,
                certificate.getNotBefore().toInstant(),
                certificate.getNotAfter().toInstant(),
                keySize,
                certificate.getSerialNumber().toString(16),
                HexFormat.ofDelimiter(":").withUpperCase().formatHex(digest),
                pem);
    }
}
