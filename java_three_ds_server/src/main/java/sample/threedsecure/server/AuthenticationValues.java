package sample.threedsecure.server;

import java.util.Base64;

/**
 * Mock CAVV values returned after a challenge.
 */
public final class AuthenticationValues {

    private static final int CAVV_LENGTH = 20;

    public static final String FAILED = "AAAAAAAAAAAAAAAAAAAAAA==";

    private AuthenticationValues() {
    }

    /**
     * Deterministic 20 byte CAVV: version 0x02, method 0x01, then a fixed filler.
     */
    public static String authentic() {
        byte[] cavv = new byte[CAVV_LENGTH];
        cavv[0] = 0x02;
        cavv[1] = 0x01;
        for (int i = 2; i < CAVV_LENGTH; i++) {
            cavv[i] = (byte) ((i * 17 + 13 + 0x4A) % 256);
        }
        return Base64.getEncoder().encodeToString(cavv);
    }

    public static String forOutcome(boolean authenticated) {
        return authenticated ? authentic() : FAILED;
    }
}
