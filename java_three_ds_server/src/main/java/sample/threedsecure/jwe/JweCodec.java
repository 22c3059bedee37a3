package sample.threedsecure.jwe;

import sample.threedsecure.ChallengeCryptoException;
import sample.threedsecure.ecdh.DerivedKeyMaterial;

/**
 * Content encryption for one {@code enc} value.
 */
public interface JweCodec {

    String getEncryptionMethod();

    JweEnvelope encrypt(byte[] plaintext, String kid, DerivedKeyMaterial key, KeyUsage usage)
        throws ChallengeCryptoException;

    byte[] decrypt(JweEnvelope envelope, DerivedKeyMaterial key, KeyUsage usage)
        throws ChallengeCryptoException;
}
