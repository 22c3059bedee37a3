package sample.threedsecure.ecdh;

import org.json.JSONException;
import org.json.JSONObject;
import sample.threedsecure.ChallengeCryptoException;
import sample.threedsecure.InvalidEphemeralKeyException;
import sample.threedsecure.UnsupportedPlatformException;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.interfaces.ECPublicKey;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns an ECDH shared secret into the 32 bytes of content key material for
 * one platform. The SDK reference number of the platform goes into the
 * Concat KDF PartyVInfo, so the same secret yields different keys per platform.
 */
public class KeyDerivationService {

    /**
     * @param sharedSecret 32 byte ECDH output
     * @param encAlgId encryption method the key will be used with; must be the one bound to {@code platform}
     * @param platform SDK platform that selects the reference number
     */
    public DerivedKeyMaterial deriveKey(byte[] sharedSecret, String encAlgId, Platform platform)
            throws ChallengeCryptoException {
        if (!platform.getEncryptionMethod().equals(encAlgId)) {
            throw new UnsupportedPlatformException(
                "Encryption method " + encAlgId + " is not used by platform " + platform.getPlatformName());
        }
        if (sharedSecret == null || sharedSecret.length != ECDHConstants.COORDINATE_LENGTH) {
            throw new InvalidEphemeralKeyException("Shared secret must be 32 bytes");
        }
        try {
            byte[] otherInfo = ECDHCryptoUtils.buildOtherInfo(platform.getSdkReferenceNumber());
            byte[] keyBytes = ECDHCryptoUtils.concatKDF(sharedSecret, ECDHConstants.DERIVED_KEY_LENGTH, otherInfo);
            Logger.getGlobal().log(Level.FINE, "KeyDerivationService:deriveKey derived key for {0}",
                platform.getPlatformName());
            return new DerivedKeyMaterial(keyBytes, platform);
        } catch (GeneralSecurityException e) {
            throw new ChallengeCryptoException("Concat KDF failed", e);
        }
    }

    /**
     * ECDH with the SDK's public JWK followed by {@link #deriveKey(byte[], String, Platform)}.
     */
    public DerivedKeyMaterial deriveKey(PrivateKey acsPrivateKey, JSONObject sdkPublicJwk, Platform platform)
            throws ChallengeCryptoException {
        ECPublicKey sdkPublicKey = toPublicKey(sdkPublicJwk);
        byte[] sharedSecret;
        try {
            sharedSecret = ECDHCryptoUtils.computeSharedSecret(acsPrivateKey, sdkPublicKey);
        } catch (GeneralSecurityException e) {
            throw new InvalidEphemeralKeyException("ECDH agreement failed", e);
        }
        return deriveKey(sharedSecret, platform.getEncryptionMethod(), platform);
    }

    /**
     * Parse and validate an EC P-256 public JWK.
     */
    public static ECPublicKey toPublicKey(JSONObject jwk) throws InvalidEphemeralKeyException {
        if (jwk == null) {
            throw new InvalidEphemeralKeyException("SDK ephemeral public key is missing");
        }
        try {
            if (!ECDHConstants.JWK_KEY_TYPE.equals(jwk.getString("kty"))
                    || !ECDHConstants.JWK_CURVE.equals(jwk.getString("crv"))) {
                throw new InvalidEphemeralKeyException("SDK ephemeral key must be an EC P-256 key");
            }
            byte[] x = ECDHCryptoUtils.base64UrlDecode(jwk.getString("x"));
            byte[] y = ECDHCryptoUtils.base64UrlDecode(jwk.getString("y"));
            if (x.length != ECDHConstants.COORDINATE_LENGTH || y.length != ECDHConstants.COORDINATE_LENGTH) {
                throw new InvalidEphemeralKeyException("SDK ephemeral key coordinates must be 32 bytes");
            }
            return ECDHCryptoUtils.publicKeyFromCoordinates(x, y);
        } catch (JSONException | IllegalArgumentException e) {
            throw new InvalidEphemeralKeyException("SDK ephemeral key is not a valid JWK", e);
        } catch (GeneralSecurityException e) {
            throw new InvalidEphemeralKeyException("SDK ephemeral key is not a point on P-256", e);
        }
    }
}
