package sample.threedsecure.ecdh;

import org.apache.commons.codec.binary.Hex;
import org.bouncycastle.jce.ECNamedCurveTable;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.jce.spec.ECNamedCurveParameterSpec;
import org.bouncycastle.jce.spec.ECPrivateKeySpec;
import org.bouncycastle.jce.spec.ECPublicKeySpec;
import org.bouncycastle.math.ec.ECPoint;

import javax.crypto.KeyAgreement;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Security;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.util.Arrays;
import java.util.Base64;

/**
 * Utility class for the P-256 operations behind the challenge channel: key
 * generation, ECDH agreement, Concat KDF and conversion between keys and
 * their JWK coordinates.
 */
public class ECDHCryptoUtils {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private static final ECNamedCurveParameterSpec CURVE_SPEC =
        ECNamedCurveTable.getParameterSpec(ECDHConstants.CURVE_NAME);

    /**
     * Generate an EC key pair using SECP256R1 curve (NIST P-256).
     */
    public static KeyPair generateECDHKeyPair(SecureRandom random) throws GeneralSecurityException {
        KeyPairGenerator keyPairGenerator =
            KeyPairGenerator.getInstance(ECDHConstants.KEY_ALGORITHM, ECDHConstants.PROVIDER);
        keyPairGenerator.initialize(new ECGenParameterSpec(ECDHConstants.CURVE_NAME), random);
        return keyPairGenerator.generateKeyPair();
    }

    /**
     * Raw ECDH agreement. Returns the 32 byte x-coordinate of the shared point.
     */
    public static byte[] computeSharedSecret(PrivateKey privateKey, PublicKey peerPublicKey)
            throws GeneralSecurityException {
        KeyAgreement keyAgreement =
            KeyAgreement.getInstance(ECDHConstants.AGREEMENT_ALGORITHM, ECDHConstants.PROVIDER);
        keyAgreement.init(privateKey);
        keyAgreement.doPhase(peerPublicKey, true);
        return keyAgreement.generateSecret();
    }

    /**
     * Concat KDF implementation (NIST SP 800-56A Rev. 3, single step, SHA-256).
     */
    public static byte[] concatKDF(byte[] sharedSecret, int keyDataLen, byte[] otherInfo)
            throws GeneralSecurityException {
        MessageDigest digest = MessageDigest.getInstance(ECDHConstants.KDF_DIGEST);
        ByteArrayOutputStream baos = new ByteArrayOutputStream();

        int reps = (keyDataLen + 31) / 32;

        for (int counter = 1; counter <= reps; counter++) {
            digest.reset();
            digest.update(ByteBuffer.allocate(4).putInt(counter).array());
            digest.update(sharedSecret);
            digest.update(otherInfo);
            baos.writeBytes(digest.digest());
        }

        return Arrays.copyOf(baos.toByteArray(), keyDataLen);
    }

    /**
     * OtherInfo as the EMV 3DS SDKs expect it: empty AlgorithmID and PartyUInfo
     * (each a zero length prefix), PartyVInfo carrying the SDK reference number,
     * and SuppPubInfo holding the key length in bits.
     */
    public static byte[] buildOtherInfo(String sdkReferenceNumber) {
        byte[] partyV = sdkReferenceNumber.getBytes(StandardCharsets.US_ASCII);
        return ByteBuffer.allocate(4 + 4 + 4 + partyV.length + 4)
            .putInt(0)
            .putInt(0)
            .putInt(partyV.length)
            .put(partyV)
            .putInt(ECDHConstants.DERIVED_KEY_BITS)
            .array();
    }

    /**
     * Rebuild a public key from its affine coordinates. The point must lie on P-256.
     */
    public static ECPublicKey publicKeyFromCoordinates(byte[] x, byte[] y) throws GeneralSecurityException {
        ECPoint point;
        try {
            point = CURVE_SPEC.getCurve().validatePoint(new BigInteger(1, x), new BigInteger(1, y));
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Point is not on curve " + ECDHConstants.CURVE_NAME, e);
        }
        KeyFactory keyFactory = KeyFactory.getInstance(ECDHConstants.KEY_ALGORITHM, ECDHConstants.PROVIDER);
        return (ECPublicKey) keyFactory.generatePublic(new ECPublicKeySpec(point, CURVE_SPEC));
    }

    public static PrivateKey privateKeyFromScalar(byte[] d) throws GeneralSecurityException {
        KeyFactory keyFactory = KeyFactory.getInstance(ECDHConstants.KEY_ALGORITHM, ECDHConstants.PROVIDER);
        return keyFactory.generatePrivate(new ECPrivateKeySpec(new BigInteger(1, d), CURVE_SPEC));
    }

    public static boolean isOnCurve(ECPublicKey publicKey) {
        try {
            CURVE_SPEC.getCurve().validatePoint(
                publicKey.getW().getAffineX(), publicKey.getW().getAffineY());
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Big-endian unsigned encoding, left padded with zeros to {@code length} bytes.
     */
    public static byte[] toFixedLength(BigInteger value, int length) {
        byte[] raw = value.toByteArray();
        if (raw.length == length) {
            return raw;
        }
        byte[] result = new byte[length];
        if (raw.length > length) {
            // drop the sign byte
            System.arraycopy(raw, raw.length - length, result, 0, length);
        } else {
            System.arraycopy(raw, 0, result, length - raw.length, raw.length);
        }
        return result;
    }

    public static String base64UrlEncode(byte[] data) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(data);
    }

    public static byte[] base64UrlDecode(String data) {
        return Base64.getUrlDecoder().decode(data);
    }

    /**
     * Convert byte array to hex string.
     */
    public static String bytesToHex(byte[] bytes) {
        return Hex.encodeHexString(bytes);
    }
}
