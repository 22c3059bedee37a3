package sample.threedsecure;

/**
 * The ACS signing certificate or its private key could not be read, parsed
 * or paired.
 */
public class CertificateLoadException extends ChallengeCryptoException {

    private static final long serialVersionUID = 1L;

    public CertificateLoadException(String message) {
        super(message);
    }

    public CertificateLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
