package sample.threedsecure.jwe;

import sample.threedsecure.AuthenticationFailedException;
import sample.threedsecure.ChallengeCryptoException;
import sample.threedsecure.MalformedEnvelopeException;
import sample.threedsecure.ecdh.DerivedKeyMaterial;
import sample.threedsecure.ecdh.ECDHConstants;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * AES-128-CBC with HMAC-SHA-256 (RFC 7518 section 5.2.3), used by the Android SDK.
 *
 * The first 16 bytes of the derived material are the MAC key and the last 16
 * the AES key, in both directions. The tag is the first 16 bytes of
 * HMAC(AAD || IV || ciphertext || AL) where AL is the AAD length in bits as
 * a 64-bit big-endian integer.
 */
public class A128CbcHs256Codec extends AbstractJweCodec {

    private static final String CIPHER_MODE = "AES/CBC/PKCS5Padding";
    private static final String MAC_ALGORITHM = "HmacSHA256";
    private static final int IV_LENGTH = 16;

    public A128CbcHs256Codec() {
        this(new SecureRandom());
    }

    public A128CbcHs256Codec(SecureRandom secureRandom) {
        super(secureRandom);
    }

    @Override
    public String getEncryptionMethod() {
        return ECDHConstants.ENC_A128CBC_HS256;
    }

    @Override
    protected int getIvLength() {
        return IV_LENGTH;
    }

    @Override
    protected JweEnvelope encrypt(byte[] plaintext, JweHeader header, DerivedKeyMaterial key,
                                  KeyUsage usage, byte[] iv) throws ChallengeCryptoException {
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_MODE);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key.secondHalf(), "AES"), new IvParameterSpec(iv));
            byte[] ciphertext = cipher.doFinal(plaintext);
            byte[] aad = header.encode().getBytes(StandardCharsets.US_ASCII);
            byte[] tag = computeTag(key.firstHalf(), aad, iv, ciphertext);
            return new JweEnvelope(header, iv, ciphertext, tag);
        } catch (GeneralSecurityException e) {
            throw new ChallengeCryptoException("A128CBC-HS256 encryption failed", e);
        }
    }

    @Override
    protected byte[] decryptVerified(JweEnvelope envelope, DerivedKeyMaterial key, KeyUsage usage)
            throws ChallengeCryptoException {
        byte[] iv = envelope.getIv();
        byte[] ciphertext = envelope.getCiphertext();
        byte[] expectedTag;
        try {
            expectedTag = computeTag(key.firstHalf(), envelope.getAdditionalAuthenticatedData(), iv, ciphertext);
        } catch (GeneralSecurityException e) {
            throw new ChallengeCryptoException("Unable to compute authentication tag", e);
        }
        if (!MessageDigest.isEqual(expectedTag, envelope.getTag())) {
            throw new AuthenticationFailedException("A128CBC-HS256 authentication tag mismatch");
        }
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_MODE);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key.secondHalf(), "AES"), new IvParameterSpec(iv));
            return cipher.doFinal(ciphertext);
        } catch (BadPaddingException | IllegalBlockSizeException e) {
            throw new MalformedEnvelopeException("Ciphertext has invalid block padding", e);
        } catch (GeneralSecurityException e) {
            throw new ChallengeCryptoException("A128CBC-HS256 decryption failed", e);
        }
    }

    static byte[] computeTag(byte[] macKey, byte[] aad, byte[] iv, byte[] ciphertext)
            throws GeneralSecurityException {
        Mac mac = Mac.getInstance(MAC_ALGORITHM);
        mac.init(new SecretKeySpec(macKey, MAC_ALGORITHM));
        mac.update(aad);
        mac.update(iv);
        mac.update(ciphertext);
        mac.update(ByteBuffer.allocate(8).putLong((long) aad.length * 8).array());
        return Arrays.copyOf(mac.doFinal(), TAG_LENGTH);
    }
}
