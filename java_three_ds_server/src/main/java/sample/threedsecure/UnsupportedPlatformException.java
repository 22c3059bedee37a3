package sample.threedsecure;

/**
 * Raised when an encryption method or platform name does not map to a
 * supported SDK platform.
 */
public class UnsupportedPlatformException extends ChallengeCryptoException {

    private static final long serialVersionUID = 1L;

    public UnsupportedPlatformException(String message) {
        super(message);
    }
}
