package sample.threedsecure.jwe;

import org.json.JSONObject;
import sample.threedsecure.ecdh.DerivedKeyMaterial;
import sample.threedsecure.ecdh.Platform;

/**
 * A decrypted CReq and the key context needed to answer it.
 */
public final class DecryptedChallenge {

    private final JSONObject message;
    private final JweHeader header;
    private final Platform platform;
    private final DerivedKeyMaterial key;

    DecryptedChallenge(JSONObject message, JweHeader header, Platform platform, DerivedKeyMaterial key) {
        this.message = message;
        this.header = header;
        this.platform = platform;
        this.key = key;
    }

    public JSONObject getMessage() {
        return message;
    }

    public JweHeader getHeader() {
        return header;
    }

    public Platform getPlatform() {
        return platform;
    }

    public DerivedKeyMaterial getKey() {
        return key;
    }
}
