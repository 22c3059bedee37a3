package sample.threedsecure.ecdh;

import sample.threedsecure.UnsupportedPlatformException;

/**
 * Mobile SDK platform. Each platform is bound to exactly one SDK reference
 * number and one content encryption method.
 */
public enum Platform {

    ANDROID("android", ECDHConstants.ANDROID_SDK_REFERENCE_NUMBER, ECDHConstants.ENC_A128CBC_HS256),
    IOS("ios", ECDHConstants.IOS_SDK_REFERENCE_NUMBER, ECDHConstants.ENC_A128GCM);

    private final String platformName;
    private final String sdkReferenceNumber;
    private final String encryptionMethod;

    Platform(String platformName, String sdkReferenceNumber, String encryptionMethod) {
        this.platformName = platformName;
        this.sdkReferenceNumber = sdkReferenceNumber;
        this.encryptionMethod = encryptionMethod;
    }

    public String getPlatformName() {
        return platformName;
    }

    public String getSdkReferenceNumber() {
        return sdkReferenceNumber;
    }

    public String getEncryptionMethod() {
        return encryptionMethod;
    }

    /**
     * Case-sensitive lookup by platform name ("android" or "ios").
     */
    public static Platform fromName(String name) throws UnsupportedPlatformException {
        for (Platform platform : values()) {
            if (platform.platformName.equals(name)) {
                return platform;
            }
        }
        throw new UnsupportedPlatformException("Unsupported platform: " + name);
    }

    public static Platform fromEncryptionMethod(String enc) throws UnsupportedPlatformException {
        for (Platform platform : values()) {
            if (platform.encryptionMethod.equals(enc)) {
                return platform;
            }
        }
        throw new UnsupportedPlatformException("Unsupported encryption method: " + enc);
    }
}
