package sample.threedsecure.jwe;

import org.json.JSONException;
import org.json.JSONObject;
import sample.threedsecure.MalformedEnvelopeException;
import sample.threedsecure.ecdh.ECDHCryptoUtils;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Protected header of a challenge JWE. Only direct key agreement is used,
 * so {@code alg} is always "dir" and {@code kid} carries the acsTransID.
 */
public final class JweHeader {

    public static final String ALG_DIRECT = "dir";

    private final String alg;
    private final String enc;
    private final String kid;

    public JweHeader(String enc, String kid) {
        this(ALG_DIRECT, enc, kid);
    }

    JweHeader(String alg, String enc, String kid) {
        this.alg = Objects.requireNonNull(alg, "alg");
        this.enc = Objects.requireNonNull(enc, "enc");
        this.kid = Objects.requireNonNull(kid, "kid");
    }

    public String getAlg() {
        return alg;
    }

    public String getEnc() {
        return enc;
    }

    public String getKid() {
        return kid;
    }

    /**
     * Serialized JSON with members in the order alg, enc, kid. Receivers
     * authenticate the encoded bytes, so the order must never vary.
     */
    public String toJson() {
        return "{\"alg\":" + JSONObject.quote(alg)
            + ",\"enc\":" + JSONObject.quote(enc)
            + ",\"kid\":" + JSONObject.quote(kid) + "}";
    }

    public String encode() {
        return ECDHCryptoUtils.base64UrlEncode(toJson().getBytes(StandardCharsets.UTF_8));
    }

    public static JweHeader decode(String encodedHeader) throws MalformedEnvelopeException {
        JSONObject json;
        try {
            json = new JSONObject(new String(ECDHCryptoUtils.base64UrlDecode(encodedHeader), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException | JSONException e) {
            throw new MalformedEnvelopeException("JWE header is not base64url encoded JSON", e);
        }
        String alg = json.optString("alg", null);
        String enc = json.optString("enc", null);
        String kid = json.optString("kid", null);
        if (alg == null || enc == null || kid == null) {
            throw new MalformedEnvelopeException("JWE header must contain alg, enc and kid");
        }
        if (!ALG_DIRECT.equals(alg)) {
            throw new MalformedEnvelopeException("Unsupported JWE alg: " + alg);
        }
        return new JweHeader(alg, enc, kid);
    }

    @Override
    public String toString() {
        return toJson();
    }
}
