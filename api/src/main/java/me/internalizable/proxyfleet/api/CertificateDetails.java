package me.internalizable.proxyfleet.api;

import javax.annotation.Nonnull;
import java.time.Instant;

/**
 * Fields parsed from an instance's certificate on disk.
 *
 * @param commonName subject CN
 * @param notBefore start of the validity window
 * @param notAfter end of the validity window
 * @param keySize RSA modulus size in bits
 * @param serialNumber serial number in hex
 * @param sha256Fingerprint colon-separated SHA-256 fingerprint of the DER encoding
 * @param pem the certificate in PEM form
 */
public record CertificateDetails(
        @Nonnull String commonName,
        @Nonnull Instant notBefore,
        @Nonnull Instant notAfter,
        int keySize,
        @Nonnull String serialNumber,
        @Nonnull String sha256Fingerprint,
        @Nonnull String pem
) {

    /**
     * Check whether the certificate is valid at the given moment.
     *
     * @param now moment to test
     * @return true if inside the validity window
     */
    public boolean isValidAt(@Nonnull Instant now) {
        return !now.isBefore(notBefore) && !now.isAfter(notAfter);
    }
}
