package me.internalizable.proxyfleet.api;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Parameters for a self-signed server certificate.
 *
 * <p>A null common name lets the manager pick one: the cover domain for TLS
 * tunnels, {@code localhost} otherwise. Range checks happen in the manager so
 * the error surfaces as a validation failure.</p>
 *
 * @param commonName subject CN, or null for the instance default
 * @param validityDays days from issuance until expiry
 * @param keySize RSA modulus size in bits
 * @param organization subject O
 * @param country subject C, two letters
 */
public record CertificateParams(
        @Nullable String commonName,
        int validityDays,
        int keySize,
        @Nonnull String organization,
        @Nonnull String country
) {

    public static final int DEFAULT_VALIDITY_DAYS = 365;
    public static final int DEFAULT_KEY_SIZE = 2048;
    public static final String DEFAULT_ORGANIZATION = "Proxy Fleet Manager";
    public static final String DEFAULT_COUNTRY = "US";

    public CertificateParams {
        if (organization == null) {
            organization = DEFAULT_ORGANIZATION;
        }
        if (country == null) {
            country = DEFAULT_COUNTRY;
        }
    }

    /**
     * Default parameters with an instance-derived common name.
     *
     * @return default parameters
     */
    @Nonnull
    public static CertificateParams defaults() {
        return new CertificateParams(null, DEFAULT_VALIDITY_DAYS, DEFAULT_KEY_SIZE,
                DEFAULT_ORGANIZATION, DEFAULT_COUNTRY);
    }

    /**
     * Default parameters with the given common name.
     *
     * @param commonName subject CN
     * @return parameters
     */
    @Nonnull
    public static CertificateParams forCommonName(@Nonnull String commonName) {
        return defaults().withCommonName(commonName);
    }

    @Nonnull
    public CertificateParams withCommonName(@Nullable String commonName) {
        return new CertificateParams(commonName, validityDays, keySize, organization, country);
    }

    @Nonnull
    public CertificateParams withValidityDays(int validityDays) {
        return new CertificateParams(commonName, validityDays, keySize, organization, country);
    }

    @Nonnull
    public CertificateParams withKeySize(int keySize) {
        return new CertificateParams(commonName, validityDays, keySize, organization, country);
    }
}
