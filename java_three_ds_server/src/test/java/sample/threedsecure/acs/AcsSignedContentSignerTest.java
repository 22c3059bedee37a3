package sample.threedsecure.acs;

import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.util.X509CertUtils;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.json.JSONObject;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import sample.threedsecure.ecdh.ECDHCryptoUtils;
import sample.threedsecure.ecdh.EphemeralKeyGenerator;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPublicKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.Assert.*;

/**
 * Tests for the acsSignedContent JWT and its fallback.
 */
public class AcsSignedContentSignerTest {

    private static final String ACS_TRANS_ID = "0f6f1c8e-5b7c-4b0e-9d53-4f1b6f3a2c11";
    private static final String ACS_URL = "http://127.0.0.1:8080/challenge";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final List<LogRecord> records = new ArrayList<>();
    private final Handler capture = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    private X509Certificate certificate;
    private AcsSignedContentSigner signer;
    private final JSONObject ephemeralJwk = new EphemeralKeyGenerator().generate().toPublicJwk();

    @Before
    public void setUp() throws Exception {
        KeyPair keyPair = TestCertificates.rsaKeyPair();
        certificate = TestCertificates.selfSigned(keyPair);
        signer = new AcsSignedContentSigner(new AcsKeyMaterial(certificate, keyPair.getPrivate()));
        Logger.getGlobal().addHandler(capture);
    }

    @After
    public void tearDown() {
        Logger.getGlobal().removeHandler(capture);
    }

    @Test
    public void testSignedContentVerifiesWithX5cCertificate() throws Exception {
        AcsSignedContent content = signer.sign(ACS_TRANS_ID, "issuer1", ACS_URL, ephemeralJwk);
        assertEquals(AcsSignedContent.Kind.SIGNED, content.getKind());
        assertNull(content.getReason());

        SignedJWT jwt = SignedJWT.parse(content.getJwt());
        assertEquals(JWSAlgorithm.PS256, jwt.getHeader().getAlgorithm());
        assertEquals(JOSEObjectType.JWT, jwt.getHeader().getType());
        assertEquals("x5c should carry exactly the ACS certificate", 1, jwt.getHeader().getX509CertChain().size());

        X509Certificate fromHeader = X509CertUtils.parse(jwt.getHeader().getX509CertChain().get(0).decode());
        assertArrayEquals(certificate.getEncoded(), fromHeader.getEncoded());
        assertTrue("Signature should verify with the x5c key",
            jwt.verify(new RSASSAVerifier((RSAPublicKey) fromHeader.getPublicKey())));
    }

    @Test
    public void testClaims() throws Exception {
        AcsSignedContent content = signer.sign(ACS_TRANS_ID, "issuer1", ACS_URL, ephemeralJwk);
        JWTClaimsSet claims = SignedJWT.parse(content.getJwt()).getJWTClaimsSet();

        assertEquals(ACS_TRANS_ID, claims.getStringClaim("acsTransID"));
        assertEquals("issuer1", claims.getStringClaim("acsRefNumber"));
        assertEquals(ACS_URL, claims.getStringClaim("acsURL"));
        Map<String, Object> key = claims.getJSONObjectClaim("acsEphemPubKey");
        assertEquals("EC", key.get("kty"));
        assertEquals("P-256", key.get("crv"));
        assertEquals(ephemeralJwk.getString("x"), key.get("x"));
        assertEquals(ephemeralJwk.getString("y"), key.get("y"));
        assertFalse("Private scalar must never be signed into the content", key.containsKey("d"));
    }

    @Test
    public void testTamperedPayloadFailsVerification() throws Exception {
        String[] parts = signer.sign(ACS_TRANS_ID, "issuer1", ACS_URL, ephemeralJwk).getJwt().split("\\.");
        JSONObject payload = new JSONObject(new String(ECDHCryptoUtils.base64UrlDecode(parts[1]), StandardCharsets.UTF_8));
        payload.put("acsURL", "http://attacker.example/challenge");
        String tampered = parts[0] + "." + ECDHCryptoUtils.base64UrlEncode(
            payload.toString().getBytes(StandardCharsets.UTF_8)) + "." + parts[2];

        assertFalse("Modified payload must not verify",
            SignedJWT.parse(tampered).verify(new RSASSAVerifier((RSAPublicKey) certificate.getPublicKey())));
    }

    @Test
    public void testMissingFilesFallBackWithWarning() throws Exception {
        File missing = new File(folder.getRoot(), "missing.pem");
        AcsSignedContentSigner fallbackSigner = AcsSignedContentSigner.fromFiles(missing.toPath(), missing.toPath());
        assertFalse(fallbackSigner.isSigningAvailable());

        records.clear();
        AcsSignedContent content = fallbackSigner.sign(ACS_TRANS_ID, "issuer1", ACS_URL, ephemeralJwk);

        assertTrue(content.isFallback());
        assertEquals(AcsSignedContentSigner.FALLBACK_SIGNED_CONTENT, content.getJwt());
        assertNotNull("Fallback should say why", content.getReason());
        assertTrue("Fallback should be logged as a warning",
            records.stream().anyMatch(r -> r.getLevel() == Level.WARNING));
    }

    @Test
    public void testFallbackContentIsWellFormed() throws Exception {
        SignedJWT jwt = SignedJWT.parse(AcsSignedContentSigner.FALLBACK_SIGNED_CONTENT);
        assertEquals(JWSAlgorithm.PS256, jwt.getHeader().getAlgorithm());
        assertEquals("8a880dc0-d2d2-4067-bcb1-b08d1690b26e", jwt.getJWTClaimsSet().getStringClaim("acsTransID"));
        assertEquals(ACS_URL, jwt.getJWTClaimsSet().getStringClaim("acsURL"));
        assertEquals("P-256", jwt.getJWTClaimsSet().getJSONObjectClaim("acsEphemPubKey").get("crv"));
        assertNull("Placeholder carries no certificate chain", jwt.getHeader().getX509CertChain());
        assertFalse("Placeholder must not verify with a real ACS key",
            jwt.verify(new RSASSAVerifier((RSAPublicKey) certificate.getPublicKey())));
    }

    @Test
    public void testFilesOnDiskAreUsed() throws Exception {
        KeyPair keyPair = TestCertificates.rsaKeyPair();
        File certFile = folder.newFile("acs-cert.pem");
        File keyFile = folder.newFile("acs-private-key.pem");
        TestCertificates.writeCertificate(TestCertificates.selfSigned(keyPair), certFile);
        TestCertificates.writePkcs1Key(keyPair, keyFile);

        AcsSignedContentSigner fileSigner = AcsSignedContentSigner.fromFiles(certFile.toPath(), keyFile.toPath());
        assertTrue(fileSigner.isSigningAvailable());
        assertFalse(fileSigner.sign(ACS_TRANS_ID, "issuer1", ACS_URL, ephemeralJwk).isFallback());
    }

    @Test
    public void testCreateAcsUrl() {
        assertEquals(ACS_URL, AcsSignedContentSigner.createAcsUrl("http://127.0.0.1:8080"));
        assertEquals(ACS_URL, AcsSignedContentSigner.createAcsUrl("http://127.0.0.1:8080/"));
    }
}
