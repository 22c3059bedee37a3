package sample.threedsecure.transaction;

import org.json.JSONObject;
import sample.threedsecure.ecdh.EphemeralKeyPair;

import java.security.GeneralSecurityException;

/**
 * Everything remembered about one 3DS transaction between the
 * authentication request, the challenge and the results message. The ACS
 * ephemeral key pair lives here from ARes until the CReq is answered.
 */
public class TransactionRecord {

    private String threeDSServerTransId;
    private String acsTransId;
    private String dsTransId;
    private String sdkTransId;
    private JSONObject authenticateRequest;
    private JSONObject resultsRequest;
    private EphemeralKeyPair ephemeralKeys;
    private JSONObject sdkEphemeralPublicKey;
    private String redirectUrl;

    public String getThreeDSServerTransId() {
        return threeDSServerTransId;
    }

    public void setThreeDSServerTransId(String threeDSServerTransId) {
        this.threeDSServerTransId = threeDSServerTransId;
    }

    public String getAcsTransId() {
        return acsTransId;
    }

    public void setAcsTransId(String acsTransId) {
        this.acsTransId = acsTransId;
    }

    public String getDsTransId() {
        return dsTransId;
    }

    public void setDsTransId(String dsTransId) {
        this.dsTransId = dsTransId;
    }

    public String getSdkTransId() {
        return sdkTransId;
    }

    public void setSdkTransId(String sdkTransId) {
        this.sdkTransId = sdkTransId;
    }

    public JSONObject getAuthenticateRequest() {
        return authenticateRequest;
    }

    public void setAuthenticateRequest(JSONObject authenticateRequest) {
        this.authenticateRequest = authenticateRequest;
    }

    public JSONObject getResultsRequest() {
        return resultsRequest;
    }

    public void setResultsRequest(JSONObject resultsRequest) {
        this.resultsRequest = resultsRequest;
    }

    public EphemeralKeyPair getEphemeralKeys() {
        return ephemeralKeys;
    }

    public void setEphemeralKeys(EphemeralKeyPair ephemeralKeys) {
        this.ephemeralKeys = ephemeralKeys;
    }

    public JSONObject getSdkEphemeralPublicKey() {
        return sdkEphemeralPublicKey;
    }

    public void setSdkEphemeralPublicKey(JSONObject sdkEphemeralPublicKey) {
        this.sdkEphemeralPublicKey = sdkEphemeralPublicKey;
    }

    public String getRedirectUrl() {
        return redirectUrl;
    }

    public void setRedirectUrl(String redirectUrl) {
        this.redirectUrl = redirectUrl;
    }

    /**
     * Serialized form kept by the store. The ephemeral private scalar is included.
     */
    public String toJson() {
        JSONObject json = new JSONObject();
        json.put("threeDSServerTransId", threeDSServerTransId);
        json.put("acsTransId", acsTransId);
        json.put("dsTransId", dsTransId);
        json.putOpt("sdkTransId", sdkTransId);
        json.putOpt("authenticateRequest", authenticateRequest);
        json.putOpt("resultsRequest", resultsRequest);
        if (ephemeralKeys != null) {
            json.put("ephemeralKeys", ephemeralKeys.toPersistedJson());
        }
        json.putOpt("sdkEphemeralPublicKey", sdkEphemeralPublicKey);
        json.putOpt("redirectUrl", redirectUrl);
        return json.toString();
    }

    public static TransactionRecord fromJson(String serialized) throws GeneralSecurityException {
        JSONObject json = new JSONObject(serialized);
        TransactionRecord record = new TransactionRecord();
        record.setThreeDSServerTransId(json.getString("threeDSServerTransId"));
        record.setAcsTransId(json.getString("acsTransId"));
        record.setDsTransId(json.getString("dsTransId"));
        record.setSdkTransId(json.optString("sdkTransId", null));
        record.setAuthenticateRequest(json.optJSONObject("authenticateRequest"));
        record.setResultsRequest(json.optJSONObject("resultsRequest"));
        JSONObject keys = json.optJSONObject("ephemeralKeys");
        if (keys != null) {
            record.setEphemeralKeys(EphemeralKeyPair.fromPersistedJson(keys));
        }
        record.setSdkEphemeralPublicKey(json.optJSONObject("sdkEphemeralPublicKey"));
        record.setRedirectUrl(json.optString("redirectUrl", null));
        return record;
    }
}
