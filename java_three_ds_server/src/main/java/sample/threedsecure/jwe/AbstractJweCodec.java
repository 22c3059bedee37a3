package sample.threedsecure.jwe;

import sample.threedsecure.ChallengeCryptoException;
import sample.threedsecure.MalformedEnvelopeException;
import sample.threedsecure.UnsupportedPlatformException;
import sample.threedsecure.ecdh.DerivedKeyMaterial;

import java.security.SecureRandom;

/**
 * Shared envelope checks for the challenge codecs. Subclasses only supply
 * the cipher work.
 */
public abstract class AbstractJweCodec implements JweCodec {

    protected static final int TAG_LENGTH = 16;

    private final SecureRandom secureRandom;

    protected AbstractJweCodec(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    protected abstract int getIvLength();

    protected abstract JweEnvelope encrypt(byte[] plaintext, JweHeader header, DerivedKeyMaterial key,
                                           KeyUsage usage, byte[] iv) throws ChallengeCryptoException;

    protected abstract byte[] decryptVerified(JweEnvelope envelope, DerivedKeyMaterial key, KeyUsage usage)
        throws ChallengeCryptoException;

    @Override
    public JweEnvelope encrypt(byte[] plaintext, String kid, DerivedKeyMaterial key, KeyUsage usage)
            throws ChallengeCryptoException {
        byte[] iv = new byte[getIvLength()];
        secureRandom.nextBytes(iv);
        return encrypt(plaintext, kid, key, usage, iv);
    }

    /**
     * Encrypt with a caller supplied IV. Only tests should pick the IV.
     */
    JweEnvelope encrypt(byte[] plaintext, String kid, DerivedKeyMaterial key, KeyUsage usage, byte[] iv)
            throws ChallengeCryptoException {
        checkKey(key);
        return encrypt(plaintext, new JweHeader(getEncryptionMethod(), kid), key, usage, iv);
    }

    @Override
    public byte[] decrypt(JweEnvelope envelope, DerivedKeyMaterial key, KeyUsage usage)
            throws ChallengeCryptoException {
        checkKey(key);
        if (!getEncryptionMethod().equals(envelope.getHeader().getEnc())) {
            throw new UnsupportedPlatformException("Envelope enc " + envelope.getHeader().getEnc()
                + " cannot be handled by " + getEncryptionMethod());
        }
        if (envelope.getIv().length != getIvLength()) {
            throw new MalformedEnvelopeException("IV must be " + getIvLength() + " bytes for " + getEncryptionMethod());
        }
        if (envelope.getTag().length != TAG_LENGTH) {
            throw new MalformedEnvelopeException("Authentication tag must be " + TAG_LENGTH + " bytes");
        }
        return decryptVerified(envelope, key, usage);
    }

    private void checkKey(DerivedKeyMaterial key) throws UnsupportedPlatformException {
        if (!getEncryptionMethod().equals(key.getPlatform().getEncryptionMethod())) {
            throw new UnsupportedPlatformException("Key derived for " + key.getPlatform().getPlatformName()
                + " cannot be used with " + getEncryptionMethod());
        }
    }
}
