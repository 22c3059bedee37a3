package sample.threedsecure.ecdh;

import sample.threedsecure.KeyGenerationFailureException;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Produces a fresh P-256 key pair per challenge transaction.
 */
public class EphemeralKeyGenerator {

    private final SecureRandom secureRandom;

    public EphemeralKeyGenerator() {
        this(new SecureRandom());
    }

    public EphemeralKeyGenerator(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    public EphemeralKeyPair generate() {
        try {
            return new EphemeralKeyPair(ECDHCryptoUtils.generateECDHKeyPair(secureRandom));
        } catch (GeneralSecurityException e) {
            Logger.getGlobal().log(Level.SEVERE, "EphemeralKeyGenerator:generate EC key generation failed", e);
            throw new KeyGenerationFailureException("Unable to generate P-256 ephemeral key pair", e);
        }
    }
}
