package sample.threedsecure.server;

import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jwt.SignedJWT;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;
import org.springframework.mock.web.MockHttpServletResponse;
import sample.threedsecure.ecdh.EphemeralKeyGenerator;
import sample.threedsecure.transaction.TransactionRecord;

import java.nio.charset.StandardCharsets;
import java.security.interfaces.RSAPublicKey;
import java.util.Base64;
import java.util.UUID;

import static org.junit.Assert.*;

/**
 * Version, authentication, results and final outcome endpoints.
 */
public class ThreeDSServerServiceTest {

    private ServerFixture fixture;

    @Before
    public void setUp() throws Exception {
        fixture = new ServerFixture();
    }

    private static JSONObject sdkKey() {
        return new EphemeralKeyGenerator().generate().toPublicJwk();
    }

    @Test
    public void testHealth() throws Exception {
        MockHttpServletResponse response = fixture.getHealth();
        assertEquals(200, response.getStatus());
        JSONObject body = new JSONObject(response.getContentAsString());
        assertEquals("healthy", body.getString("status"));
        assertEquals("3ds-mock-server", body.getString("service"));
        assertTrue(body.has("timestamp"));
    }

    @Test
    public void testVersionCardRanges() throws Exception {
        JSONObject mastercard = fixture.postJson("/3ds/version",
            new JSONObject().put("cardNumber", "5155012345678901"), 200);
        JSONObject range = mastercard.getJSONArray("cardRanges").getJSONObject(0);
        assertEquals("5155010000000000", range.getString("startRange"));
        assertEquals("5155019999999999", range.getString("endRange"));
        assertEquals("2.2.0", range.getString("acsStartProtocolVersion"));

        JSONObject visa = fixture.postJson("/3ds/version",
            new JSONObject().put("cardNumber", ServerFixture.FRICTIONLESS_CARD), 200);
        assertEquals("4000000000000000", visa.getJSONArray("cardRanges").getJSONObject(0).getString("startRange"));
        assertNotNull(UUID.fromString(visa.getString("threeDsServerTransId")));
    }

    @Test
    public void testVersionWithoutCardNumber() throws Exception {
        JSONObject error = fixture.postJson("/3ds/version", new JSONObject(), 400);
        assertTrue(error.has("error"));
    }

    @Test
    public void testBrowserFrictionless() throws Exception {
        String id = UUID.randomUUID().toString();
        JSONObject response = fixture.postJson("/3ds/authenticate",
            ServerFixture.authenticateRequest(id, "02", ServerFixture.FRICTIONLESS_CARD, null), 200);

        assertEquals("Y", response.getString("transStatus"));
        assertEquals("N", response.getString("acsChallengeMandated"));
        assertFalse(response.has("base64EncodedChallengeRequest"));
        assertFalse(response.has("acsUrl"));
        JSONObject ares = response.getJSONObject("authenticationResponse");
        assertEquals("ARes", ares.getString("messageType"));
        assertEquals("05", ares.getString("eci"));
        assertEquals("MOCK_ACS", ares.getString("acsOperatorID"));
        assertEquals("issuer1", ares.getString("acsReferenceNumber"));
        assertFalse(ares.has("acsSignedContent"));

        TransactionRecord stored = fixture.store.get(id).orElseThrow();
        assertEquals(ares.getString("acsTransId"), stored.getAcsTransId());
        assertEquals(ServerFixture.REDIRECT_URL, stored.getRedirectUrl());
        assertNull(stored.getEphemeralKeys());
    }

    @Test
    public void testBrowserChallengeByCardSuffix() throws Exception {
        String id = UUID.randomUUID().toString();
        JSONObject response = fixture.postJson("/3ds/authenticate",
            ServerFixture.authenticateRequest(id, "02", ServerFixture.CHALLENGE_CARD, null), 200);

        assertEquals("C", response.getString("transStatus"));
        assertEquals("Y", response.getString("acsChallengeMandated"));
        assertEquals("http://127.0.0.1:8080/processor/mock/acs/trigger-otp", response.getString("acsUrl"));
        assertEquals(response.getString("acsUrl"), response.getJSONObject("authenticationResponse").getString("acsUrl"));

        JSONObject creq = new JSONObject(new String(
            Base64.getDecoder().decode(response.getString("base64EncodedChallengeRequest")), StandardCharsets.UTF_8));
        assertEquals("CReq", creq.getString("messageType"));
        assertEquals(id, creq.getString("threeDsServerTransId"));
        assertEquals("2.2.0", creq.getString("messageVersion"));
    }

    @Test
    public void testChallengeIndicatorOverridesCard() throws Exception {
        JSONObject mandated = fixture.postJson("/3ds/authenticate", ServerFixture.authenticateRequest(
            UUID.randomUUID().toString(), "02", ServerFixture.FRICTIONLESS_CARD, "04"), 200);
        assertEquals("C", mandated.getString("transStatus"));

        JSONObject exempt = fixture.postJson("/3ds/authenticate", ServerFixture.authenticateRequest(
            UUID.randomUUID().toString(), "02", ServerFixture.CHALLENGE_CARD, "05"), 200);
        assertEquals("Y", exempt.getString("transStatus"));
        JSONObject ares = exempt.getJSONObject("authenticationResponse");
        assertEquals("MOCK_ACS_NEW", ares.getString("acsOperatorID"));
        assertEquals("issuer2", ares.getString("acsReferenceNumber"));
    }

    @Test
    public void testMobileWithoutSdkTransIdRejected() throws Exception {
        JSONObject error = fixture.postJson("/3ds/authenticate", ServerFixture.authenticateRequest(
            UUID.randomUUID().toString(), "01", ServerFixture.CHALLENGE_CARD, null), 400);
        assertEquals("sdkTransId is required for mobile flows (deviceChannel=01)", error.getString("error"));
    }

    @Test
    public void testMobileChallengeCarriesSignedContent() throws Exception {
        String id = UUID.randomUUID().toString();
        JSONObject sdkKey = sdkKey();
        JSONObject request = ServerFixture.authenticateRequest(id, "01", ServerFixture.CHALLENGE_CARD, null);
        request.put("sdkTransId", UUID.randomUUID().toString());
        request.put("sdkEphemeralPublicKey", sdkKey);

        JSONObject response = fixture.postJson("/3ds/authenticate", request, 200);
        JSONObject ares = response.getJSONObject("authenticationResponse");
        assertEquals("C", ares.getString("transStatus"));
        assertEquals(request.getString("sdkTransId"), ares.getString("sdkTransId"));
        assertFalse("App flows have no browser acsUrl", response.has("acsUrl"));

        SignedJWT jwt = SignedJWT.parse(ares.getString("acsSignedContent"));
        assertTrue(jwt.verify(new RSASSAVerifier((RSAPublicKey) fixture.acsCertificate.getPublicKey())));
        assertEquals(ares.getString("acsTransId"), jwt.getJWTClaimsSet().getStringClaim("acsTransID"));
        assertEquals("http://127.0.0.1:8080/challenge", jwt.getJWTClaimsSet().getStringClaim("acsURL"));

        TransactionRecord stored = fixture.store.get(id).orElseThrow();
        JSONObject acsEphemPubKey = new JSONObject(jwt.getJWTClaimsSet().getJSONObjectClaim("acsEphemPubKey"));
        assertEquals(stored.getEphemeralKeys().toPublicJwk().getString("x"), acsEphemPubKey.getString("x"));
        assertEquals(sdkKey.getString("x"), stored.getSdkEphemeralPublicKey().getString("x"));
        assertEquals(sdkKey.getString("y"),
            response.getJSONObject("authenticationRequest").getJSONObject("sdkEphemeralPublicKey").getString("y"));
    }

    @Test
    public void testMobileTopLevelSdkKeyMembers() throws Exception {
        String id = UUID.randomUUID().toString();
        JSONObject sdkKey = sdkKey();
        JSONObject request = ServerFixture.authenticateRequest(id, "01", ServerFixture.CHALLENGE_CARD, null);
        request.put("sdkTransId", UUID.randomUUID().toString());
        request.put("Kty", sdkKey.getString("kty"));
        request.put("Crv", sdkKey.getString("crv"));
        request.put("X", sdkKey.getString("x"));
        request.put("Y", sdkKey.getString("y"));

        fixture.postJson("/3ds/authenticate", request, 200);
        assertEquals(sdkKey.toString(), fixture.store.get(id).orElseThrow().getSdkEphemeralPublicKey().toString());
    }

    @Test
    public void testMobileFrictionlessHasNoSignedContent() throws Exception {
        JSONObject request = ServerFixture.authenticateRequest(UUID.randomUUID().toString(), "01",
            ServerFixture.FRICTIONLESS_CARD, null);
        request.put("sdkTransId", UUID.randomUUID().toString());
        JSONObject ares = fixture.postJson("/3ds/authenticate", request, 200).getJSONObject("authenticationResponse");
        assertEquals("Y", ares.getString("transStatus"));
        assertFalse(ares.has("acsSignedContent"));
    }

    @Test
    public void testAuthenticationRequestEcho() throws Exception {
        String id = UUID.randomUUID().toString();
        JSONObject areq = fixture.postJson("/3ds/authenticate",
            ServerFixture.authenticateRequest(id, "02", ServerFixture.FRICTIONLESS_CARD, null), 200)
            .getJSONObject("authenticationRequest");
        assertEquals("AReq", areq.getString("messageType"));
        assertEquals(id, areq.getString("threeDSServerTransID"));
        assertEquals("1000", areq.getString("purchaseAmount"));
        assertEquals(ServerFixture.REDIRECT_URL, areq.getString("notificationURL"));
        assertEquals(ServerFixture.FRICTIONLESS_CARD, areq.getString("acctNumber"));
    }

    @Test
    public void testResultsAndFinal() throws Exception {
        String id = UUID.randomUUID().toString();
        JSONObject ares = fixture.postJson("/3ds/authenticate",
            ServerFixture.authenticateRequest(id, "02", ServerFixture.CHALLENGE_CARD, null), 200)
            .getJSONObject("authenticationResponse");

        JSONObject notYet = fixture.postJson("/3ds/final", new JSONObject().put("threeDsServerTransId", id), 400);
        assertEquals("Results not found for this transaction", notYet.getString("error"));

        JSONObject rreq = new JSONObject()
            .put("threeDsServerTransId", id)
            .put("messageType", "RReq")
            .put("transStatus", "N")
            .put("eci", "07")
            .put("authenticationValue", AuthenticationValues.FAILED);
        JSONObject rres = fixture.postJson("/3ds/results", rreq, 200);
        assertEquals("RRes", rres.getString("messageType"));
        assertEquals("01", rres.getString("resultsStatus"));
        assertEquals(ares.getString("acsTransId"), rres.getString("acsTransId"));

        JSONObject result = fixture.postJson("/3ds/final", new JSONObject().put("threeDsServerTransId", id), 200);
        assertEquals("N", result.getString("transStatus"));
        assertEquals("07", result.getString("eci"));
        assertEquals(AuthenticationValues.FAILED, result.getString("authenticationValue"));

        JSONObject again = fixture.postJson("/3ds/final", new JSONObject().put("threeDsServerTransId", id), 200);
        assertEquals("Final outcome stays available until the transaction expires",
            "N", again.getString("transStatus"));
    }

    @Test
    public void testResultsForUnknownTransaction() throws Exception {
        JSONObject error = fixture.postJson("/3ds/results",
            new JSONObject().put("threeDsServerTransId", UUID.randomUUID().toString()), 400);
        assertEquals("Transaction not found", error.getString("error"));
        fixture.postJson("/3ds/final", new JSONObject().put("threeDsServerTransId", "unknown"), 400);
    }
}
