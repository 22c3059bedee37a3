package sample.threedsecure.acs;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.util.Base64;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.apache.commons.lang3.StringUtils;
import org.json.JSONObject;
import sample.threedsecure.CertificateLoadException;
import sample.threedsecure.CommonConstants;

import java.nio.file.Path;
import java.security.cert.CertificateEncodingException;
import java.util.Collections;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Produces the acsSignedContent JWT (PS256, x5c header) that hands the ACS
 * ephemeral public key and challenge URL to the SDK.
 *
 * When the signing material is unavailable or signing fails the signer
 * returns a fixed unverifiable placeholder JWT instead and logs a warning. That fallback
 * keeps the authentication flow alive; SDKs that verify the signature will
 * reject it.
 */
public class AcsSignedContentSigner {

    /**
     * Fixed placeholder in PS256 JWT shape for acsTransID 8a880dc0-d2d2-4067-bcb1-b08d1690b26e,
     * acsRefNumber issuer1, acsURL http://127.0.0.1:8080/challenge. The signature
     * segment is filler and the header carries no x5c, so it cannot be verified.
     */
    public static final String FALLBACK_SIGNED_CONTENT =
        "eyJhbGciOiJQUzI1NiIsInR5cCI6IkpXVCJ9."
        + "eyJhY3NUcmFuc0lEIjoiOGE4ODBkYzAtZDJkMi00MDY3LWJjYjEtYjA4ZDE2OTBiMjZlIiwiYWNzUmVmTnVtYmVyIjoiaXNzdWVyMSIs"
        + "ImFjc1VSTCI6Imh0dHA6Ly8xMjcuMC4wLjE6ODA4MC9jaGFsbGVuZ2UiLCJhY3NFcGhlbVB1YktleSI6eyJrdHkiOiJFQyIsImNydiI6"
        + "IlAtMjU2IiwieCI6ImFfaGRYLWhGbUxFTXBobWV3SnpOZlRYYzF4bGYzUjNIYzNvTVp3QnU4bEUiLCJ5IjoidVZMeVh1d2Q3dEg4b1pH"
        + "RGlaQkdZMWZURkszN2ZwZGd1Tm12eVBPYWxhMCJ9fQ."
        + "fxOSpOVAbaYXlFnnHH7C0u90nBi9oAGxHUGXibb0EM0eZey5jHDCj5UB-q9V_B4UAHrOdG9FWUuv_op5K-_yd38TkqTlQG2mF5RZ5xx-"
        + "wtLvdJwYvaABsR1Bl4m29BDNHmXsuYxwwo-VAfqvVfweFAB6znRvRVlLr_6KeSvv8nd_E5Kk5UBtpheUWeccfsLS73ScGL2gAbEdQZeJ"
        + "tvQQzR5l7LmMcMKPlQH6r1X8HhQAes50b0VZS6_-inkr7_J3fxOSpOVAbaYXlFnnHH7C0u90nBi9oAGxHUGXibb0EM0eZey5jHDCj5UB"
        + "-q9V_B4UAHrOdG9FWUuv_op5K-_ydw";

    private final AcsKeyMaterial keyMaterial;
    private final String unavailableReason;

    public AcsSignedContentSigner(AcsKeyMaterial keyMaterial) {
        this(keyMaterial, null);
    }

    private AcsSignedContentSigner(AcsKeyMaterial keyMaterial, String unavailableReason) {
        this.keyMaterial = keyMaterial;
        this.unavailableReason = unavailableReason;
    }

    /**
     * Signer backed by PEM files. Load failures are not fatal: the signer is
     * created in fallback mode and every {@link #sign} call reports why.
     */
    public static AcsSignedContentSigner fromFiles(Path certificatePath, Path privateKeyPath) {
        try {
            return new AcsSignedContentSigner(AcsKeyMaterialLoader.load(certificatePath, privateKeyPath));
        } catch (CertificateLoadException e) {
            Logger.getGlobal().log(Level.WARNING,
                "AcsSignedContentSigner:fromFiles ACS signing material unavailable, using fallback content: {0}",
                e.getMessage());
            return new AcsSignedContentSigner(null, e.getMessage());
        }
    }

    public boolean isSigningAvailable() {
        return keyMaterial != null;
    }

    public AcsSignedContent sign(String acsTransId, String acsRefNumber, String acsUrl,
                                 JSONObject ephemeralPublicJwk) {
        if (keyMaterial == null) {
            return fallback(unavailableReason);
        }
        try {
            JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.PS256)
                .type(JOSEObjectType.JWT)
                .x509CertChain(Collections.singletonList(Base64.encode(keyMaterial.getCertificate().getEncoded())))
                .build();

            JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .claim("acsTransID", acsTransId)
                .claim("acsRefNumber", acsRefNumber)
                .claim("acsURL", acsUrl)
                .claim("acsEphemPubKey", ephemeralPublicJwk.toMap())
                .build();

            SignedJWT signedJWT = new SignedJWT(header, claims);
            signedJWT.sign(new RSASSASigner(keyMaterial.getPrivateKey()));

            Logger.getGlobal().log(Level.INFO, "AcsSignedContentSigner:sign signed content for acsTransID {0}",
                acsTransId);
            return AcsSignedContent.signed(signedJWT.serialize());
        } catch (JOSEException | CertificateEncodingException | IllegalArgumentException e) {
            return fallback("Signing failed: " + e.getMessage());
        }
    }

    private AcsSignedContent fallback(String reason) {
        Logger.getGlobal().log(Level.WARNING,
            "AcsSignedContentSigner:sign returning fixed fallback acsSignedContent: {0}", reason);
        return AcsSignedContent.fallback(FALLBACK_SIGNED_CONTENT, reason);
    }

    /**
     * Challenge endpoint URL for a server base URL, e.g. http://127.0.0.1:8080/challenge.
     */
    public static String createAcsUrl(String serverBaseUrl) {
        return StringUtils.removeEnd(serverBaseUrl, "/") + CommonConstants.ACS_CHALLENGE_API;
    }
}
