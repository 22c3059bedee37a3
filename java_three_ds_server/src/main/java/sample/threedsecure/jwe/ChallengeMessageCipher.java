package sample.threedsecure.jwe;

import org.json.JSONException;
import org.json.JSONObject;
import sample.threedsecure.ChallengeCryptoException;
import sample.threedsecure.MalformedEnvelopeException;
import sample.threedsecure.UnsupportedPlatformException;
import sample.threedsecure.ecdh.DerivedKeyMaterial;
import sample.threedsecure.ecdh.KeyDerivationService;
import sample.threedsecure.ecdh.Platform;

import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Protects challenge messages between the ACS and the SDK. This is the only
 * place that chooses a codec: the platform comes from the request's
 * {@code enc}, and the response is encrypted for that same platform with the
 * key derived for the request.
 */
public class ChallengeMessageCipher {

    private final KeyDerivationService keyDerivationService;
    private final PlatformDetector platformDetector;
    private final Map<Platform, JweCodec> codecs = new EnumMap<>(Platform.class);

    public ChallengeMessageCipher(KeyDerivationService keyDerivationService, PlatformDetector platformDetector) {
        this(keyDerivationService, platformDetector, new A128CbcHs256Codec(), new A128GcmCodec());
    }

    public ChallengeMessageCipher(KeyDerivationService keyDerivationService, PlatformDetector platformDetector,
                                  JweCodec androidCodec, JweCodec iosCodec) {
        this.keyDerivationService = keyDerivationService;
        this.platformDetector = platformDetector;
        this.codecs.put(Platform.ANDROID, androidCodec);
        this.codecs.put(Platform.IOS, iosCodec);
    }

    public JweCodec codecFor(Platform platform) {
        return codecs.get(platform);
    }

    /**
     * Parse only the protected header, so the transaction can be located by
     * {@code kid} before any key is available.
     */
    public JweEnvelope parse(String compactJwe) throws MalformedEnvelopeException {
        return JweEnvelope.parse(compactJwe);
    }

    public DecryptedChallenge decryptRequest(JweEnvelope envelope, PrivateKey acsPrivateKey, JSONObject sdkPublicJwk)
            throws ChallengeCryptoException {
        Platform platform = platformDetector.detect(envelope.getHeader());
        Logger.getGlobal().log(Level.INFO, "ChallengeMessageCipher:decryptRequest detected platform {0}",
            platform.getPlatformName());

        DerivedKeyMaterial key = keyDerivationService.deriveKey(acsPrivateKey, sdkPublicJwk, platform);
        byte[] plaintext = codecFor(platform).decrypt(envelope, key, KeyUsage.DECRYPT_HALF);
        try {
            JSONObject message = new JSONObject(new String(plaintext, StandardCharsets.UTF_8));
            return new DecryptedChallenge(message, envelope.getHeader(), platform, key);
        } catch (JSONException e) {
            throw new MalformedEnvelopeException("Decrypted challenge request is not a JSON object", e);
        }
    }

    public String encryptResponse(JSONObject response, String kid, DerivedKeyMaterial key)
            throws ChallengeCryptoException {
        JweCodec codec = codecFor(key.getPlatform());
        if (codec == null) {
            throw new UnsupportedPlatformException("No codec for platform " + key.getPlatform());
        }
        byte[] plaintext = response.toString().getBytes(StandardCharsets.UTF_8);
        return codec.encrypt(plaintext, kid, key, KeyUsage.ENCRYPT_HALF).serialize();
    }
}
