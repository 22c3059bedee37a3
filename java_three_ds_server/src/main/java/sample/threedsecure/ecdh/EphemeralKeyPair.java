package sample.threedsecure.ecdh;

import org.json.JSONObject;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;

/**
 * A single-transaction P-256 key pair together with its public JWK form.
 *
 * The private scalar can be exported with {@link #toPersistedJson()} so the
 * pair survives between the authentication request and the first challenge
 * message, and rebuilt with {@link #fromPersistedJson(JSONObject)}.
 */
public final class EphemeralKeyPair {

    private final ECPublicKey publicKey;
    private final PrivateKey privateKey;

    public EphemeralKeyPair(KeyPair keyPair) {
        this((ECPublicKey) keyPair.getPublic(), keyPair.getPrivate());
    }

    private EphemeralKeyPair(ECPublicKey publicKey, PrivateKey privateKey) {
        this.publicKey = publicKey;
        this.privateKey = privateKey;
    }

    public ECPublicKey getPublicKey() {
        return publicKey;
    }

    public PrivateKey getPrivateKey() {
        return privateKey;
    }

    /**
     * Public JWK {kty, crv, x, y}. Coordinates are always 32 bytes before encoding.
     */
    public JSONObject toPublicJwk() {
        JSONObject jwk = new JSONObject();
        jwk.put("kty", ECDHConstants.JWK_KEY_TYPE);
        jwk.put("crv", ECDHConstants.JWK_CURVE);
        jwk.put("x", encodeCoordinate(publicKey.getW().getAffineX()));
        jwk.put("y", encodeCoordinate(publicKey.getW().getAffineY()));
        return jwk;
    }

    public JSONObject toPersistedJson() {
        JSONObject json = new JSONObject();
        json.put("publicKey", toPublicJwk());
        json.put("d", encodeCoordinate(((ECPrivateKey) privateKey).getS()));
        return json;
    }

    public static EphemeralKeyPair fromPersistedJson(JSONObject json) throws GeneralSecurityException {
        JSONObject jwk = json.getJSONObject("publicKey");
        ECPublicKey publicKey = ECDHCryptoUtils.publicKeyFromCoordinates(
            ECDHCryptoUtils.base64UrlDecode(jwk.getString("x")),
            ECDHCryptoUtils.base64UrlDecode(jwk.getString("y")));
        PrivateKey privateKey = ECDHCryptoUtils.privateKeyFromScalar(
            ECDHCryptoUtils.base64UrlDecode(json.getString("d")));
        return new EphemeralKeyPair(publicKey, privateKey);
    }

    private static String encodeCoordinate(BigInteger value) {
        return ECDHCryptoUtils.base64UrlEncode(
            ECDHCryptoUtils.toFixedLength(value, ECDHConstants.COORDINATE_LENGTH));
    }
}
