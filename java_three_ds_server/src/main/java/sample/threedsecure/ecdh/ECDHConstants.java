package sample.threedsecure.ecdh;

/**
 * Constants for the ephemeral ECDH agreement between the ACS and the 3DS SDK.
 */
public interface ECDHConstants {

    // Curve
    String CURVE_NAME = "secp256r1";
    String JWK_KEY_TYPE = "EC";
    String JWK_CURVE = "P-256";
    int COORDINATE_LENGTH = 32;

    String PROVIDER = "BC";
    String KEY_ALGORITHM = "EC";
    String AGREEMENT_ALGORITHM = "ECDH";

    // SDK reference numbers, one per certified SDK build
    String ANDROID_SDK_REFERENCE_NUMBER = "3DS_LOA_SDK_JTPL_020200_00788";
    String IOS_SDK_REFERENCE_NUMBER = "3DS_LOA_SDK_JTPL_020200_00805";

    // Concat KDF
    String KDF_DIGEST = "SHA-256";
    int DERIVED_KEY_LENGTH = 32;
    int DERIVED_KEY_BITS = DERIVED_KEY_LENGTH * 8;

    // Encryption methods
    String ENC_A128CBC_HS256 = "A128CBC-HS256";
    String ENC_A128GCM = "A128GCM";
}
