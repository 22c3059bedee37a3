package sample.threedsecure;

public class InvalidEphemeralKeyException extends ChallengeCryptoException {

    private static final long serialVersionUID = 1L;

    public InvalidEphemeralKeyException(String message) {
        super(message);
    }

    public InvalidEphemeralKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
