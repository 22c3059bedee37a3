package sample.threedsecure;

/**
 * Compact serialization could not be parsed into a valid envelope.
 */
public class MalformedEnvelopeException extends ChallengeCryptoException {

    private static final long serialVersionUID = 1L;

    public MalformedEnvelopeException(String message) {
        super(message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
