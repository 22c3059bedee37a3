package sample.threedsecure.ecdh;

import java.util.Arrays;
import java.util.Objects;

/**
 * 32 bytes of Concat KDF output bound to the platform it was derived for.
 * The two 16 byte halves are exposed separately because the codecs split
 * the material differently.
 */
public final class DerivedKeyMaterial {

    private final byte[] keyBytes;
    private final Platform platform;

    public DerivedKeyMaterial(byte[] keyBytes, Platform platform) {
        Objects.requireNonNull(keyBytes, "keyBytes");
        Objects.requireNonNull(platform, "platform");
        if (keyBytes.length != ECDHConstants.DERIVED_KEY_LENGTH) {
            throw new IllegalArgumentException(
                "Derived key must be " + ECDHConstants.DERIVED_KEY_LENGTH + " bytes, got " + keyBytes.length);
        }
        this.keyBytes = keyBytes.clone();
        this.platform = platform;
    }

    public Platform getPlatform() {
        return platform;
    }

    public byte[] getEncoded() {
        return keyBytes.clone();
    }

    /** Bytes 0..15. */
    public byte[] firstHalf() {
        return Arrays.copyOfRange(keyBytes, 0, 16);
    }

    /** Bytes 16..31. */
    public byte[] secondHalf() {
        return Arrays.copyOfRange(keyBytes, 16, 32);
    }

    @Override
    public String toString() {
        return "DerivedKeyMaterial[platform=" + platform + "]";
    }
}
