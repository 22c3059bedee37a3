package sample.threedsecure.jwe;

import sample.threedsecure.UnsupportedPlatformException;
import sample.threedsecure.ecdh.Platform;

/**
 * Infers the SDK platform from the {@code enc} member of an incoming JWE.
 * A128CBC-HS256 means Android, A128GCM means iOS. Anything else is rejected.
 */
public class PlatformDetector {

    public Platform detect(JweHeader header) throws UnsupportedPlatformException {
        return detect(header.getEnc());
    }

    public Platform detect(String enc) throws UnsupportedPlatformException {
        return Platform.fromEncryptionMethod(enc);
    }
}
