package sample.threedsecure;

/**
 * Authentication tag did not verify. No plaintext is released.
 */
public class AuthenticationFailedException extends ChallengeCryptoException {

    private static final long serialVersionUID = 1L;

    public AuthenticationFailedException(String message) {
        super(message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
