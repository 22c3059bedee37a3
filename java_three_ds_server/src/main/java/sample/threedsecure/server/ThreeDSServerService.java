package sample.threedsecure.server;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import sample.threedsecure.ServerSettings;
import sample.threedsecure.ServiceConstants;
import sample.threedsecure.acs.AcsSignedContent;
import sample.threedsecure.acs.AcsSignedContentSigner;
import sample.threedsecure.ecdh.EphemeralKeyGenerator;
import sample.threedsecure.ecdh.EphemeralKeyPair;
import sample.threedsecure.transaction.TransactionNotFoundException;
import sample.threedsecure.transaction.TransactionRecord;
import sample.threedsecure.transaction.TransactionStore;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 3DS Server side of the mock: version lookup, authentication (AReq/ARes),
 * results and final outcome.
 */
@RestController
public class ThreeDSServerService implements ServiceConstants {

    // authenticationRequest member, source section, source member
    private static final String[][] ECHOED_FIELDS = {
        {"shipAddrLine3", "cardholder", "shipAddrLine3"},
        {"purchaseCurrency", "purchase", "purchaseCurrency"},
        {"email", "cardholder", "email"},
        {"shipAddrPostCode", "cardholder", "shipAddrPostCode"},
        {"billAddrLine2", "cardholder", "billAddrLine2"},
        {"merchantCountryCode", "merchant", "merchantCountryCode"},
        {"acquirerBIN", "acquirer", "acquirerBin"},
        {"purchaseDate", "purchase", "purchaseDate"},
        {"threeDSRequestorName", "merchant", "threeDsRequestorName"},
        {"acquirerMerchantID", "acquirer", "acquirerMerchantId"},
        {"billAddrLine3", "cardholder", "billAddrLine3"},
        {"threeDSRequestorChallengeInd", "threeDsRequestor", "threeDsRequestorChallengeInd"},
        {"shipAddrLine2", "cardholder", "shipAddrLine2"},
        {"acctType", "cardholderAccount", "acctType"},
        {"merchantName", "merchant", "merchantName"},
        {"threeDSRequestorID", "merchant", "threeDsRequestorId"},
        {"billAddrCountry", "cardholder", "billAddrCountry"},
        {"addrMatch", "cardholder", "addrMatch"},
        {"threeDSRequestorAuthenticationInd", "threeDsRequestor", "threeDsRequestorAuthenticationInd"},
        {"shipAddrLine1", "cardholder", "shipAddrLine1"},
        {"notificationURL", "merchant", "notificationUrl"},
        {"shipAddrCountry", "cardholder", "shipAddrCountry"},
        {"billAddrCity", "cardholder", "billAddrCity"},
        {"cardExpiryDate", "cardholderAccount", "cardExpiryDate"},
        {"billAddrLine1", "cardholder", "billAddrLine1"},
        {"cardSecurityCode", "cardholderAccount", "cardSecurityCode"},
        {"purchaseAmount", "purchase", "purchaseAmount"},
        {"transType", "purchase", "transType"},
        {"billAddrPostCode", "cardholder", "billAddrPostCode"},
        {"mcc", "merchant", "mcc"},
        {"recurringFrequency", "purchase", "recurringFrequency"},
        {"purchaseExponent", "purchase", "purchaseExponent"},
        {"cardholderName", "cardholder", "cardholderName"},
        {"recurringExpiry", "purchase", "recurringExpiry"},
        {"threeDSRequestorURL", "merchant", "notificationUrl"},
        {"acctNumber", "cardholderAccount", "acctNumber"},
        {"shipAddrCity", "cardholder", "shipAddrCity"},
    };

    private static final String[] BROWSER_FIELDS = {
        "browserColorDepth", "browserScreenHeight", "browserIP", "browserJavaEnabled", "browserScreenWidth",
        "browserLanguage", "browserUserAgent", "browserTZ", "browserJavascriptEnabled", "browserAcceptHeader",
    };

    private final TransactionStore transactionStore;
    private final EphemeralKeyGenerator ephemeralKeyGenerator;
    private final AcsSignedContentSigner acsSignedContentSigner;
    private final TransactionResultsService resultsService;
    private final ServerSettings settings;

    public ThreeDSServerService(TransactionStore transactionStore, EphemeralKeyGenerator ephemeralKeyGenerator,
                                AcsSignedContentSigner acsSignedContentSigner,
                                TransactionResultsService resultsService, ServerSettings settings) {
        this.transactionStore = transactionStore;
        this.ephemeralKeyGenerator = ephemeralKeyGenerator;
        this.acsSignedContentSigner = acsSignedContentSigner;
        this.resultsService = resultsService;
        this.settings = settings;
    }

    @GetMapping(value = HEALTH_API, produces = MediaType.APPLICATION_JSON_VALUE)
    public String health() {
        JSONObject response = new JSONObject();
        response.put("status", "healthy");
        response.put("timestamp", Instant.now().toString());
        response.put("service", "3ds-mock-server");
        return response.toString();
    }

    /**
     * Card range lookup. Cards starting 515501 get the Mastercard test range,
     * everything else the default 4xxx range.
     */
    @PostMapping(value = THREE_DS_VERSION_API, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> version(@RequestBody String body) {
        try {
            String cardNumber = new JSONObject(body).getString("cardNumber");

            JSONObject cardRange = new JSONObject();
            cardRange.put("acsInfoInd", new JSONArray().put("01").put("02"));
            if (cardNumber.startsWith("515501")) {
                cardRange.put("startRange", "5155010000000000");
                cardRange.put("endRange", "5155019999999999");
            } else {
                cardRange.put("startRange", "4000000000000000");
                cardRange.put("endRange", "4999999999999999");
            }
            cardRange.put("acsEndProtocolVersion", MESSAGE_VERSION);
            cardRange.put("acsStartProtocolVersion", MESSAGE_VERSION);

            JSONObject response = new JSONObject();
            response.put("threeDsServerTransId", UUID.randomUUID().toString());
            response.put("cardRanges", new JSONArray().put(cardRange));
            return ok(response);
        } catch (JSONException e) {
            return badRequest("Invalid version request: " + e.getMessage());
        }
    }

    @PostMapping(value = THREE_DS_AUTHENTICATE_API, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> authenticate(@RequestBody String body) {
        JSONObject request;
        String threeDSServerTransId;
        String deviceChannel;
        String cardNumber;
        try {
            request = new JSONObject(body);
            threeDSServerTransId = request.getString("threeDsServerTransId");
            deviceChannel = request.getString("deviceChannel");
            cardNumber = request.getJSONObject("cardholderAccount").getString("acctNumber");
        } catch (JSONException e) {
            return badRequest("Invalid authentication request: " + e.getMessage());
        }
        String sdkTransId = request.optString("sdkTransId", null);
        String challengeIndicator = section(request, "threeDsRequestor").optString("threeDsRequestorChallengeInd", "");
        boolean mobile = DEVICE_CHANNEL_APP.equals(deviceChannel);

        Logger.getGlobal().log(Level.INFO,
            "ThreeDSServerService:authenticate {0} deviceChannel {1} challengeInd {2}",
            new Object[] {threeDSServerTransId, deviceChannel, challengeIndicator});

        if (mobile && sdkTransId == null) {
            return badRequest("sdkTransId is required for mobile flows (deviceChannel=01)");
        }

        boolean shouldChallenge;
        if (CHALLENGE_IND_MANDATED.equals(challengeIndicator)) {
            shouldChallenge = true;
        } else if (CHALLENGE_IND_NO_CHALLENGE.equals(challengeIndicator)) {
            shouldChallenge = false;
        } else {
            shouldChallenge = cardNumber.endsWith(CHALLENGE_CARD_SUFFIX);
        }
        String transStatus = shouldChallenge ? TRANS_STATUS_CHALLENGE : TRANS_STATUS_AUTHENTICATED;
        String acsChallengeMandated = shouldChallenge ? "Y" : "N";

        boolean exemption = CHALLENGE_IND_NO_CHALLENGE.equals(challengeIndicator);
        String acsOperatorId = exemption ? EXEMPTION_ACS_OPERATOR_ID : ACS_OPERATOR_ID;
        String acsReferenceNumber = exemption ? EXEMPTION_ACS_REFERENCE_NUMBER : ACS_REFERENCE_NUMBER;

        String acsTransId = UUID.randomUUID().toString();
        String dsTransId = UUID.randomUUID().toString();

        EphemeralKeyPair ephemeralKeys = null;
        AcsSignedContent signedContent = null;
        if (mobile && shouldChallenge) {
            ephemeralKeys = ephemeralKeyGenerator.generate();
            signedContent = acsSignedContentSigner.sign(acsTransId, acsReferenceNumber,
                AcsSignedContentSigner.createAcsUrl(settings.getServerUrl()), ephemeralKeys.toPublicJwk());
        }

        JSONObject sdkEphemeralPublicKey = mobile ? sdkEphemeralPublicKey(request) : null;
        if (mobile && sdkEphemeralPublicKey == null) {
            Logger.getGlobal().log(Level.WARNING,
                "ThreeDSServerService:authenticate mobile flow without SDK ephemeral public key {0}",
                threeDSServerTransId);
        }

        JSONObject authenticationRequest = buildAuthenticationRequest(request, threeDSServerTransId,
            sdkEphemeralPublicKey);

        TransactionRecord record = new TransactionRecord();
        record.setThreeDSServerTransId(threeDSServerTransId);
        record.setAcsTransId(acsTransId);
        record.setDsTransId(dsTransId);
        record.setSdkTransId(sdkTransId);
        record.setAuthenticateRequest(request);
        record.setEphemeralKeys(ephemeralKeys);
        record.setSdkEphemeralPublicKey(sdkEphemeralPublicKey);
        record.setRedirectUrl(section(request, "merchant").optString("notificationUrl", null));
        transactionStore.put(threeDSServerTransId, record, settings.getTransactionTtl());

        JSONObject challengeRequest = new JSONObject();
        challengeRequest.put("messageType", "CReq");
        challengeRequest.put("threeDsServerTransId", threeDSServerTransId);
        challengeRequest.put("acsTransId", acsTransId);
        challengeRequest.put("challengeWindowSize", "01");
        challengeRequest.put("messageVersion", MESSAGE_VERSION);

        String browserAcsUrl = settings.getServerUrl() + ACS_TRIGGER_OTP_API;

        JSONObject authenticationResponse = new JSONObject();
        authenticationResponse.put("acsOperatorID", acsOperatorId);
        authenticationResponse.put("dsReferenceNumber", DS_REFERENCE_NUMBER);
        authenticationResponse.put("eci", ECI_FRICTIONLESS);
        authenticationResponse.put("dsTransId", dsTransId);
        authenticationResponse.put("messageType", "ARes");
        authenticationResponse.put("threeDsServerTransId", threeDSServerTransId);
        authenticationResponse.put("acsTransId", acsTransId);
        authenticationResponse.put("acsChallengeMandated", acsChallengeMandated);
        authenticationResponse.put("authenticationType", "02");
        authenticationResponse.put("authenticationValue", ARES_AUTHENTICATION_VALUE);
        authenticationResponse.put("transStatus", transStatus);
        authenticationResponse.put("messageVersion", MESSAGE_VERSION);
        authenticationResponse.put("acsReferenceNumber", acsReferenceNumber);
        if (mobile) {
            JSONObject renderingType = new JSONObject();
            renderingType.put("deviceUserInterfaceMode", "01");
            renderingType.put("acsInterface", "01");
            renderingType.put("acsUiTemplate", "01");

            authenticationResponse.put("threeDsRequestorAppUrlInd", "N");
            authenticationResponse.putOpt("acsSignedContent", signedContent == null ? null : signedContent.getJwt());
            authenticationResponse.put("acsRenderingType", renderingType);
            authenticationResponse.put("broadInfo", broadInfo());
            authenticationResponse.put("authenticationMethod", "02");
            authenticationResponse.put("transStatusReason", "15");
            authenticationResponse.put("deviceInfoRecognisedVersion", "1.3");
            authenticationResponse.put("sdkTransId", sdkTransId);
        } else if (shouldChallenge) {
            authenticationResponse.put("acsUrl", browserAcsUrl);
        }

        JSONObject response = new JSONObject();
        response.putOpt("purchaseDate", authenticationRequest.opt("purchaseDate"));
        if (shouldChallenge) {
            response.put("base64EncodedChallengeRequest",
                Base64.getEncoder().encodeToString(challengeRequest.toString().getBytes(StandardCharsets.UTF_8)));
            if (!mobile) {
                response.put("acsUrl", browserAcsUrl);
            }
        }
        response.put("threeDsServerTransId", threeDSServerTransId);
        response.put("authenticationResponse", authenticationResponse);
        response.put("challengeRequest", challengeRequest);
        response.put("acsChallengeMandated", acsChallengeMandated);
        response.put("transStatus", transStatus);
        response.put("authenticationRequest", authenticationRequest);
        return ok(response);
    }

    @PostMapping(value = THREE_DS_RESULTS_API, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> results(@RequestBody String body) {
        try {
            return ok(resultsService.recordResults(new JSONObject(body)));
        } catch (JSONException e) {
            return badRequest("Invalid results request: " + e.getMessage());
        } catch (TransactionNotFoundException e) {
            return badRequest("Transaction not found");
        }
    }

    @PostMapping(value = THREE_DS_FINAL_API, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> finalResult(@RequestBody String body) {
        try {
            String threeDSServerTransId = new JSONObject(body).getString("threeDsServerTransId");
            Optional<JSONObject> result = resultsService.finalResult(threeDSServerTransId);
            if (result.isEmpty()) {
                return badRequest("Results not found for this transaction");
            }
            return ok(result.get());
        } catch (JSONException e) {
            return badRequest("Invalid final request: " + e.getMessage());
        } catch (TransactionNotFoundException e) {
            return badRequest("Transaction not found");
        }
    }

    private JSONObject buildAuthenticationRequest(JSONObject request, String threeDSServerTransId,
                                                  JSONObject sdkEphemeralPublicKey) {
        JSONObject areq = new JSONObject();
        for (String[] field : ECHOED_FIELDS) {
            Object value = section(request, field[1]).opt(field[2]);
            if (value instanceof Number) {
                value = value.toString();
            }
            areq.putOpt(field[0], value);
        }

        JSONObject cardholder = section(request, "cardholder");
        areq.putOpt("workPhone", phone(cardholder.optJSONObject("workPhone")));
        areq.putOpt("mobilePhone", phone(cardholder.optJSONObject("mobilePhone")));
        areq.putOpt("homePhone", phone(cardholder.optJSONObject("homePhone")));

        JSONObject renderOptions = section(request, "deviceRenderOptions");
        JSONObject deviceRenderOptions = new JSONObject();
        deviceRenderOptions.putOpt("sdkUiType", renderOptions.opt("sdkUiType"));
        deviceRenderOptions.putOpt("sdkInterface", renderOptions.opt("sdkInterface"));
        areq.put("deviceRenderOptions", deviceRenderOptions);

        JSONObject authInfo = section(section(request, "threeDsRequestor"), "threeDsRequestorAuthenticationInfo");
        JSONObject requestorAuthInfo = new JSONObject();
        requestorAuthInfo.putOpt("threeDSReqAuthMethod", authInfo.opt("threeDsReqAuthMethod"));
        requestorAuthInfo.putOpt("threeDSReqAuthTimestamp", authInfo.opt("threeDsReqAuthTimestamp"));
        areq.put("threeDSRequestorAuthenticationInfo", requestorAuthInfo);

        areq.put("messageType", "AReq");
        areq.putOpt("deviceChannel", request.opt("deviceChannel"));
        areq.put("threeDSServerTransID", threeDSServerTransId);
        areq.put("threeDSServerRefNumber", THREE_DS_SERVER_REF_NUMBER);
        areq.put("threeDSServerOperatorID", THREE_DS_SERVER_OPERATOR_ID);
        areq.put("threeDSServerURL", THREE_DS_SERVER_RESULTS_URL);
        areq.putOpt("threeDSCompInd", request.opt("threeDsCompInd"));
        areq.putOpt("messageCategory", request.opt("messageCategory"));
        areq.put("messageVersion", MESSAGE_VERSION);

        JSONObject browser = request.optJSONObject("browserInformation");
        if (browser != null) {
            for (String name : BROWSER_FIELDS) {
                areq.putOpt(name, browser.opt(name));
            }
        }
        areq.putOpt("sdkEphemeralPublicKey", sdkEphemeralPublicKey);
        return areq;
    }

    /**
     * SDK key from the nested sdkEphemeralPublicKey member, or from the
     * top-level Kty/Crv/X/Y members some SDK builds send instead.
     */
    private static JSONObject sdkEphemeralPublicKey(JSONObject request) {
        JSONObject nested = request.optJSONObject("sdkEphemeralPublicKey");
        if (nested != null) {
            return jwk(nested.optString("kty", null), nested.optString("crv", null),
                nested.optString("x", null), nested.optString("y", null));
        }
        return jwk(request.optString("Kty", null), request.optString("Crv", null),
            request.optString("X", null), request.optString("Y", null));
    }

    private static JSONObject jwk(String kty, String crv, String x, String y) {
        if (kty == null || crv == null || x == null || y == null) {
            return null;
        }
        JSONObject jwk = new JSONObject();
        jwk.put("kty", kty);
        jwk.put("crv", crv);
        jwk.put("x", x);
        jwk.put("y", y);
        return jwk;
    }

    private static JSONObject broadInfo() {
        JSONObject description = new JSONObject();
        description.put("message", "TLS 1.x will be turned off starting summer 2019");

        JSONObject broadInfo = new JSONObject();
        broadInfo.put("category", "01");
        broadInfo.put("severity", "04");
        broadInfo.put("source", "03");
        broadInfo.put("recipients", new JSONArray().put("02").put("01").put("03"));
        broadInfo.put("description", description);
        broadInfo.put("expDate", "20241231");
        return broadInfo;
    }

    private static JSONObject phone(JSONObject source) {
        if (source == null) {
            return null;
        }
        JSONObject phone = new JSONObject();
        phone.putOpt("subscriber", source.opt("subscriber"));
        phone.putOpt("cc", source.opt("cc"));
        return phone;
    }

    private static JSONObject section(JSONObject parent, String name) {
        JSONObject child = parent.optJSONObject(name);
        return child == null ? new JSONObject() : child;
    }

    private static ResponseEntity<String> ok(JSONObject body) {
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(body.toString());
    }

    private static ResponseEntity<String> badRequest(String message) {
        JSONObject error = new JSONObject();
        error.put("error", message);
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON).body(error.toString());
    }
}
