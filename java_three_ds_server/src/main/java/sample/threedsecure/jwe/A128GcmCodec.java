package sample.threedsecure.jwe;

import sample.threedsecure.AuthenticationFailedException;
import sample.threedsecure.ChallengeCryptoException;
import sample.threedsecure.ecdh.DerivedKeyMaterial;
import sample.threedsecure.ecdh.ECDHConstants;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * AES-128-GCM, used by the iOS SDK. The content key depends on direction:
 * SDK to ACS messages are keyed with bytes 0..15 of the derived material,
 * ACS to SDK messages with bytes 16..31.
 */
public class A128GcmCodec extends AbstractJweCodec {

    private static final String CIPHER_MODE = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;

    public A128GcmCodec() {
        this(new SecureRandom());
    }

    public A128GcmCodec(SecureRandom secureRandom) {
        super(secureRandom);
    }

    @Override
    public String getEncryptionMethod() {
        return ECDHConstants.ENC_A128GCM;
    }

    @Override
    protected int getIvLength() {
        return IV_LENGTH;
    }

    static byte[] contentKey(DerivedKeyMaterial key, KeyUsage usage) {
        return usage == KeyUsage.DECRYPT_HALF ? key.firstHalf() : key.secondHalf();
    }

    @Override
    protected JweEnvelope encrypt(byte[] plaintext, JweHeader header, DerivedKeyMaterial key,
                                  KeyUsage usage, byte[] iv) throws ChallengeCryptoException {
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_MODE);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(contentKey(key, usage), "AES"),
                new GCMParameterSpec(TAG_LENGTH * 8, iv));
            cipher.updateAAD(header.encode().getBytes(StandardCharsets.US_ASCII));
            byte[] output = cipher.doFinal(plaintext);
            int ciphertextLength = output.length - TAG_LENGTH;
            return new JweEnvelope(header, iv,
                Arrays.copyOfRange(output, 0, ciphertextLength),
                Arrays.copyOfRange(output, ciphertextLength, output.length));
        } catch (GeneralSecurityException e) {
            throw new ChallengeCryptoException("A128GCM encryption failed", e);
        }
    }

    @Override
    protected byte[] decryptVerified(JweEnvelope envelope, DerivedKeyMaterial key, KeyUsage usage)
            throws ChallengeCryptoException {
        byte[] ciphertext = envelope.getCiphertext();
        byte[] tag = envelope.getTag();
        byte[] input = new byte[ciphertext.length + tag.length];
        System.arraycopy(ciphertext, 0, input, 0, ciphertext.length);
        System.arraycopy(tag, 0, input, ciphertext.length, tag.length);
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_MODE);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(contentKey(key, usage), "AES"),
                new GCMParameterSpec(TAG_LENGTH * 8, envelope.getIv()));
            cipher.updateAAD(envelope.getAdditionalAuthenticatedData());
            return cipher.doFinal(input);
        } catch (AEADBadTagException e) {
            throw new AuthenticationFailedException("A128GCM authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new ChallengeCryptoException("A128GCM decryption failed", e);
        }
    }
}
