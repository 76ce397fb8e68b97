package me.internalizable.proxyfleet.manager.instance;

import me.internalizable.proxyfleet.api.CertificateParams;
import me.internalizable.proxyfleet.api.InstanceSpec;
import me.internalizable.proxyfleet.api.error.ValidationException;
import me.internalizable.proxyfleet.manager.registry.InstanceNames;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Input rules enforced before anything reaches disk.
 *
 * <p>The manager re-validates every request even though the HTTP layer in
 * front of it validates too; nothing here trusts its caller.</p>
 */
public final class InstanceValidator {

    public static final int MAX_USERNAME_LENGTH = 32;
    public static final int MAX_PASSWORD_LENGTH = 128;
    public static final int MAX_VALIDITY_DAYS = 3650;
    public static final Set<Integer> KEY_SIZES = Set.of(2048, 3072, 4096);

    private static final Pattern USERNAME = Pattern.compile("^[A-Za-z0-9_.-]{1,32}$");
    private static final Pattern HOST = Pattern.compile("^[A-Za-z0-9.-]+$");
    private static final Pattern DOMAIN = Pattern.compile(
            "^(?=.{1,253}$)[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?)*$");
    private static final Pattern COUNTRY = Pattern.compile("^[A-Za-z]{2}$");
    private static final Pattern DOTTED_QUAD = Pattern.compile("^\\d+(\\.\\d+){3}$");

    private InstanceValidator() {
    }

    /**
     * Validate a creation request. The port range is checked by the port allocator.
     *
     * @param spec creation request
     * @throws ValidationException if a field is malformed
     */
    public static void validateSpec(@Nonnull InstanceSpec spec) {
        InstanceNames.validate(spec.name());
        if (spec instanceof InstanceSpec.TlsTunnel tunnel) {
            if (tunnel.forwardAddress() == null || tunnel.forwardAddress().isBlank()) {
                throw new ValidationException("forward_address is required for tls_tunnel instances");
            }
            validateForwardAddress(tunnel.forwardAddress());
            if (tunnel.coverDomain() != null && !tunnel.coverDomain().isEmpty()) {
                validateCoverDomain(tunnel.coverDomain());
            }
        }
        if (spec.certificate() != null) {
            validateCertificateParams(spec.certificate());
        }
    }

    /**
     * Validate an upstream address of the form {@code host:port}.
     *
     * @param address the address
     * @throws ValidationException if malformed
     */
    public static void validateForwardAddress(@Nonnull String address) {
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new ValidationException("Invalid forward address '" + address + "': expected host:port");
        }
        String host = address.substring(0, colon);
        String portText = address.substring(colon + 1);
        if (!HOST.matcher(host).matches()) {
            throw new ValidationException("Invalid forward address '" + address + "': bad host");
        }
        int port;
        try {
            port = Integer.parseInt(portText);
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid forward address '" + address + "': port is not a number");
        }
        if (port < 1 || port > 65535) {
            throw new ValidationException("Port out of range in forward address '" + address + "'");
        }
    }

    /**
     * Validate a cover domain.
     *
     * @param domain the domain
     * @throws ValidationException if it is not a hostname
     */
    public static void validateCoverDomain(@Nonnull String domain) {
        if (!DOMAIN.matcher(domain).matches() || isMalformedAddress(domain)) {
            throw new ValidationException("Invalid cover domain '" + domain + "'");
        }
    }

    /**
     * Validate certificate parameters. A null common name is allowed.
     *
     * @param params the parameters
     * @throws ValidationException if a field is out of range
     */
    public static void validateCertificateParams(@Nonnull CertificateParams params) {
        if (params.commonName() != null) {
            String cn = params.commonName();
            if (cn.isBlank() || cn.length() > 64 || !HOST.matcher(cn).matches() || isMalformedAddress(cn)) {
                throw new ValidationException("Invalid certificate common name '" + cn + "'");
            }
        }
        if (params.validityDays() < 1 || params.validityDays() > MAX_VALIDITY_DAYS) {
            throw new ValidationException("Certificate validity must be between 1 and "
                    + MAX_VALIDITY_DAYS + " days");
        }
        if (!KEY_SIZES.contains(params.keySize())) {
            throw new ValidationException("Unsupported key size " + params.keySize()
                    + ": must be 2048, 3072 or 4096");
        }
        if (!COUNTRY.matcher(params.country()).matches()) {
            throw new ValidationException("Certificate country must be a two-letter code");
        }
        if (params.organization().isBlank() || params.organization().length() > 64
                || hasControlCharacter(params.organization())) {
            throw new ValidationException("Invalid certificate organization");
        }
    }

    /**
     * Check whether a value looks like an IPv4 address but is not one.
     *
     * @param value host name or address
     * @return true for a dotted quad with an octet above 255
     */
    public static boolean isMalformedAddress(@Nonnull String value) {
        if (!DOTTED_QUAD.matcher(value).matches()) {
            return false;
        }
        for (String octet : value.split("\\.")) {
            if (octet.length() > 3 || Integer.parseInt(octet) > 255) {
                return true;
            }
        }
        return false;
    }

    /**
     * Validate a basic-auth username.
     *
     * @param username the username
     * @throws ValidationException if malformed
     */
    public static void validateUsername(@Nullable String username) {
        if (username == null || !USERNAME.matcher(username).matches()) {
            throw new ValidationException("Invalid username: must be 1-" + MAX_USERNAME_LENGTH
                    + " characters of letters, digits, '_', '.' or '-'");
        }
    }

    /**
     * Validate a basic-auth password.
     *
     * @param password the password
     * @throws ValidationException if empty, too long or containing control characters
     */
    public static void validatePassword(@Nullable String password) {
        if (password == null || password.isEmpty()) {
            throw new ValidationException("Password is required");
        }
        if (password.length() > MAX_PASSWORD_LENGTH) {
            throw new ValidationException("Password must be at most " + MAX_PASSWORD_LENGTH + " characters");
        }
        if (hasControlCharacter(password)) {
            throw new ValidationException("Password must not contain control characters");
        }
    }

    private static boolean hasControlCharacter(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
