package sample.threedsecure;

/**
 * Base type for every recoverable failure raised while protecting or
 * unprotecting challenge messages. Callers map these to a protocol error
 * response instead of letting them escape to the container.
 */
public class ChallengeCryptoException extends Exception {

    private static final long serialVersionUID = 1L;

    public ChallengeCryptoException(String message) {
        super(message);
    }

    public ChallengeCryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
