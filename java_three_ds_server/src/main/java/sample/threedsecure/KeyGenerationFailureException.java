package sample.threedsecure;

/**
 * The platform's secure random source or EC implementation is unusable.
 * This is fatal for the process, so it is unchecked.
 */
public class KeyGenerationFailureException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public KeyGenerationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
