package sample.threedsecure.server;

import org.apache.commons.lang3.StringUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;
import sample.threedsecure.ChallengeCryptoException;
import sample.threedsecure.InvalidEphemeralKeyException;
import sample.threedsecure.MalformedEnvelopeException;
import sample.threedsecure.ServerSettings;
import sample.threedsecure.ServiceConstants;
import sample.threedsecure.UnsupportedPlatformException;
import sample.threedsecure.jwe.ChallengeMessageCipher;
import sample.threedsecure.jwe.DecryptedChallenge;
import sample.threedsecure.jwe.JweEnvelope;
import sample.threedsecure.transaction.TransactionNotFoundException;
import sample.threedsecure.transaction.TransactionRecord;
import sample.threedsecure.transaction.TransactionStore;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Mock ACS. Serves the encrypted app challenge (CReq/CRes over JWE) and the
 * browser OTP page with its form target.
 */
@RestController
public class AcsChallengeService implements ServiceConstants {

    public static final MediaType APPLICATION_JOSE = MediaType.parseMediaType("application/jose");

    private static final Pattern UUID_PATTERN =
        Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private static final String CHALLENGE_TEMPLATE = "templates/acs-challenge.html";

    private final TransactionStore transactionStore;
    private final ChallengeMessageCipher challengeMessageCipher;
    private final TransactionResultsService resultsService;
    private final ServerSettings settings;
    private final String challengeTemplate;

    public AcsChallengeService(TransactionStore transactionStore, ChallengeMessageCipher challengeMessageCipher,
                               TransactionResultsService resultsService, ServerSettings settings) {
        this.transactionStore = transactionStore;
        this.challengeMessageCipher = challengeMessageCipher;
        this.resultsService = resultsService;
        this.settings = settings;
        this.challengeTemplate = loadTemplate();
    }

    /**
     * App challenge. The body is a compact JWE whose kid is the acsTransID.
     * The first CReq (no challengeDataEntry) gets the OTP form description,
     * the second carries the OTP and gets the final CRes.
     */
    @PostMapping(value = ACS_CHALLENGE_API)
    public ResponseEntity<String> challenge(@RequestBody(required = false) String body) {
        if (StringUtils.isBlank(body)) {
            return challengeError(HttpStatus.BAD_REQUEST, "Invalid request body");
        }
        String trimmed = body.trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            Logger.getGlobal().log(Level.WARNING, "AcsChallengeService:challenge received JSON instead of JWE {0}",
                trimmed);
            return challengeError(HttpStatus.BAD_REQUEST, "Received JSON error response instead of JWE");
        }

        JweEnvelope envelope;
        try {
            envelope = challengeMessageCipher.parse(trimmed);
        } catch (MalformedEnvelopeException e) {
            Logger.getGlobal().log(Level.WARNING, "AcsChallengeService:challenge invalid JWE: {0}", e.getMessage());
            return challengeError(HttpStatus.BAD_REQUEST, "Invalid JWE format");
        }

        String acsTransId = envelope.getHeader().getKid();
        if (!UUID_PATTERN.matcher(acsTransId).matches()) {
            return challengeError(HttpStatus.BAD_REQUEST, "Invalid kid format: " + acsTransId);
        }

        Optional<TransactionRecord> found = transactionStore.findByAcsTransId(acsTransId);
        if (found.isEmpty()) {
            Logger.getGlobal().log(Level.INFO, "AcsChallengeService:challenge no transaction for acsTransID {0}",
                acsTransId);
            return challengeError(HttpStatus.NOT_FOUND, "Transaction not found");
        }
        TransactionRecord record = found.get();
        if (record.getEphemeralKeys() == null || record.getSdkEphemeralPublicKey() == null) {
            return challengeError(HttpStatus.BAD_REQUEST, "Missing ephemeral keys for ECDH");
        }

        DecryptedChallenge decrypted;
        try {
            decrypted = challengeMessageCipher.decryptRequest(envelope,
                record.getEphemeralKeys().getPrivateKey(), record.getSdkEphemeralPublicKey());
        } catch (UnsupportedPlatformException e) {
            Logger.getGlobal().log(Level.WARNING, "AcsChallengeService:challenge {0}", e.getMessage());
            return challengeError(HttpStatus.BAD_REQUEST, "Unsupported encryption algorithm");
        } catch (InvalidEphemeralKeyException e) {
            Logger.getGlobal().log(Level.WARNING, "AcsChallengeService:challenge {0}", e.getMessage());
            return challengeError(HttpStatus.BAD_REQUEST, "Failed to derive shared key");
        } catch (ChallengeCryptoException e) {
            Logger.getGlobal().log(Level.WARNING, "AcsChallengeService:challenge decryption failed: {0}",
                e.getMessage());
            return challengeError(HttpStatus.BAD_REQUEST, "Failed to decrypt challenge request");
        }

        JSONObject creq = decrypted.getMessage();
        JSONObject cres = creq.has("challengeDataEntry")
            ? completeChallenge(record, creq, acsTransId)
            : initialChallenge(record, creq, acsTransId);

        try {
            String jwe = challengeMessageCipher.encryptResponse(cres, acsTransId, decrypted.getKey());
            Logger.getGlobal().log(Level.INFO, "AcsChallengeService:challenge answered {0} with challengeCompletionInd {1}",
                new Object[] {acsTransId, cres.optString("challengeCompletionInd")});
            return ResponseEntity.ok().contentType(APPLICATION_JOSE).body(jwe);
        } catch (ChallengeCryptoException e) {
            Logger.getGlobal().log(Level.SEVERE, "AcsChallengeService:challenge failed to encrypt response", e);
            return challengeError(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to encrypt response");
        }
    }

    private JSONObject initialChallenge(TransactionRecord record, JSONObject creq, String acsTransId) {
        String sdkCounter = creq.optString("sdkCounterStoA", "unknown");
        if (!"000".equals(sdkCounter)) {
            Logger.getGlobal().log(Level.WARNING,
                "AcsChallengeService:initialChallenge unexpected sdkCounterStoA {0}, expected 000", sdkCounter);
        }
        JSONObject cres = new JSONObject();
        cres.put("acsTransID", acsTransId);
        cres.put("acsCounterAtoS", "000");
        cres.put("acsUiType", "01");
        cres.put("challengeCompletionInd", "N");
        cres.put("challengeInfoHeader", "Authentication Required");
        cres.put("challengeInfoLabel", "Enter OTP:");
        cres.put("messageType", "CRes");
        cres.put("messageVersion", MESSAGE_VERSION);
        cres.put("sdkTransID", Objects.toString(record.getSdkTransId(), ""));
        cres.put("threeDSServerTransID", record.getThreeDSServerTransId());
        cres.put("submitAuthenticationLabel", "Submit");
        return cres;
    }

    private JSONObject completeChallenge(TransactionRecord record, JSONObject creq, String acsTransId) {
        String sdkCounter = creq.optString("sdkCounterStoA", "unknown");
        if (!"001".equals(sdkCounter)) {
            Logger.getGlobal().log(Level.WARNING,
                "AcsChallengeService:completeChallenge unexpected sdkCounterStoA {0}, expected 001", sdkCounter);
        }
        boolean authenticated = VALID_OTP.equals(creq.optString("challengeDataEntry"));
        String messageVersion = creq.optString("messageVersion", MESSAGE_VERSION);
        recordResults(record, authenticated, messageVersion);

        JSONObject cres = new JSONObject();
        cres.put("acsCounterAtoS", "001");
        cres.put("acsTransID", acsTransId);
        cres.put("challengeCompletionInd", "Y");
        cres.put("messageType", "CRes");
        cres.put("messageVersion", messageVersion);
        cres.put("sdkTransID", Objects.toString(record.getSdkTransId(), ""));
        cres.put("threeDSServerTransID", record.getThreeDSServerTransId());
        cres.put("transStatus", authenticated ? TRANS_STATUS_AUTHENTICATED : TRANS_STATUS_NOT_AUTHENTICATED);
        return cres;
    }

    /**
     * Browser challenge page. The creq form field holds the plain CReq JSON.
     */
    @PostMapping(value = ACS_TRIGGER_OTP_API)
    public ResponseEntity<String> triggerOtp(@RequestParam("creq") String creq,
                                             @RequestParam(value = "redirectUrl", required = false) String redirectUrl) {
        String threeDSServerTransId;
        try {
            threeDSServerTransId = new JSONObject(creq).getString("threeDsServerTransId");
        } catch (JSONException e) {
            JSONObject error = new JSONObject();
            error.put("error", "Invalid JSON in challenge request");
            return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON).body(error.toString());
        }

        String targetUrl = redirectUrl;
        if (targetUrl == null) {
            targetUrl = transactionStore.get(threeDSServerTransId)
                .map(TransactionRecord::getRedirectUrl)
                .orElse(settings.getDefaultRedirectUrl());
        }

        String serverUrl = settings.getServerUrl();
        String payEndpoint = serverUrl + ACS_VERIFY_OTP_API + "?redirectUrl=" + urlEncode(targetUrl);
        String html = challengeTemplate
            .replace("{{FALLBACK_REDIRECT_URL}}", HtmlUtils.htmlEscape(serverUrl))
            .replace("{{THREE_DS_SERVER_TRANS_ID}}", HtmlUtils.htmlEscape(threeDSServerTransId))
            .replace("{{PAY_ENDPOINT}}", HtmlUtils.htmlEscape(payEndpoint));

        return ResponseEntity.ok().contentType(new MediaType(MediaType.TEXT_HTML, StandardCharsets.UTF_8)).body(html);
    }

    /**
     * OTP form target. Always answers with a redirect to the merchant.
     */
    @PostMapping(value = ACS_VERIFY_OTP_API)
    public ResponseEntity<Void> verifyOtp(@RequestParam("otp") String otp,
                                          @RequestParam("threeDSServerTransID") String threeDSServerTransId,
                                          @RequestParam(value = "redirectUrl", required = false) String redirectUrl) {
        String targetUrl = redirectUrl == null ? settings.getDefaultRedirectUrl() : redirectUrl;
        String errorRedirect = targetUrl + "?transStatus=" + TRANS_STATUS_UNAVAILABLE + "&error=processing_error";

        if (!UUID_PATTERN.matcher(threeDSServerTransId).matches()) {
            Logger.getGlobal().log(Level.WARNING, "AcsChallengeService:verifyOtp invalid transaction ID {0}",
                threeDSServerTransId);
            return redirect(errorRedirect);
        }
        Optional<TransactionRecord> found = transactionStore.get(threeDSServerTransId);
        if (found.isEmpty()) {
            Logger.getGlobal().log(Level.WARNING, "AcsChallengeService:verifyOtp transaction not found {0}",
                threeDSServerTransId);
            return redirect(errorRedirect);
        }

        boolean authenticated = VALID_OTP.equals(otp);
        JSONObject resultsRequest = recordResults(found.get(), authenticated, MESSAGE_VERSION);

        String location = targetUrl
            + "?transStatus=" + resultsRequest.getString("transStatus")
            + "&threeDSServerTransID=" + threeDSServerTransId
            + "&eci=" + resultsRequest.getString("eci")
            + "&authenticationValue=" + urlEncode(resultsRequest.getString("authenticationValue"));
        Logger.getGlobal().log(Level.INFO, "AcsChallengeService:verifyOtp redirecting to {0}", location);
        return redirect(location);
    }

    private JSONObject recordResults(TransactionRecord record, boolean authenticated, String messageVersion) {
        JSONObject resultsRequest = resultsService.buildResultsRequest(record, authenticated, messageVersion);
        try {
            resultsService.recordResults(resultsRequest);
        } catch (TransactionNotFoundException e) {
            // the challenge still completes; /3ds/final will report missing results
            Logger.getGlobal().log(Level.WARNING, "AcsChallengeService:recordResults {0}", e.getMessage());
        }
        return resultsRequest;
    }

    private static ResponseEntity<Void> redirect(String location) {
        return ResponseEntity.status(HttpStatus.FOUND).header(HttpHeaders.LOCATION, location).build();
    }

    private static ResponseEntity<String> challengeError(HttpStatus status, String description) {
        JSONObject error = new JSONObject();
        error.put("errorCode", String.valueOf(status.value()));
        error.put("errorDescription", description);
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(error.toString());
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String loadTemplate() {
        try (InputStream in = new ClassPathResource(CHALLENGE_TEMPLATE).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to load " + CHALLENGE_TEMPLATE, e);
        }
    }
}
