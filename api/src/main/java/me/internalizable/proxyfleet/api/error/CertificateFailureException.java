package me.internalizable.proxyfleet.api.error;

/**
 * Thrown when certificate generation, parsing or storage fails.
 */
public class CertificateFailureException extends FleetException {

    public CertificateFailureException(String message) {
        super(ErrorKind.CERTIFICATE, message);
    }

    public CertificateFailureException(String message, Throwable cause) {
        super(ErrorKind.CERTIFICATE, message, cause);
    }
}
