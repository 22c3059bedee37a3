package sample.threedsecure.server;

import org.json.JSONObject;
import sample.threedsecure.ServiceConstants;
import sample.threedsecure.transaction.TransactionNotFoundException;
import sample.threedsecure.transaction.TransactionRecord;
import sample.threedsecure.transaction.TransactionStore;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records RReq messages against stored transactions and builds the matching
 * RRes and final outcome. Used by the results endpoint and by both
 * challenge flows once an OTP has been checked.
 */
public class TransactionResultsService implements ServiceConstants {

    private final TransactionStore transactionStore;

    public TransactionResultsService(TransactionStore transactionStore) {
        this.transactionStore = transactionStore;
    }

    public JSONObject recordResults(JSONObject resultsRequest) throws TransactionNotFoundException {
        String threeDSServerTransId = resultsRequest.getString("threeDsServerTransId");
        TransactionRecord record = transactionStore.get(threeDSServerTransId)
            .orElseThrow(() -> new TransactionNotFoundException(threeDSServerTransId));
        record.setResultsRequest(resultsRequest);
        transactionStore.update(threeDSServerTransId, record);

        Logger.getGlobal().log(Level.INFO, "TransactionResultsService:recordResults {0} transStatus {1}",
            new Object[] {threeDSServerTransId, resultsRequest.optString("transStatus")});
        return buildResultsResponse(record);
    }

    /**
     * RReq the mock ACS sends itself after checking an OTP.
     */
    public JSONObject buildResultsRequest(TransactionRecord record, boolean authenticated, String messageVersion) {
        JSONObject acsRenderingType = new JSONObject();
        acsRenderingType.put("acsUiTemplate", "01");
        acsRenderingType.put("acsInterface", "01");

        JSONObject request = new JSONObject();
        request.put("acsTransId", record.getAcsTransId());
        request.put("messageCategory", "01");
        request.put("eci", authenticated ? ECI_CHALLENGE_SUCCESS : ECI_CHALLENGE_FAILED);
        request.put("messageType", "RReq");
        request.put("acsRenderingType", acsRenderingType);
        request.put("dsTransId", record.getDsTransId());
        request.put("authenticationMethod", "02");
        request.put("authenticationType", "02");
        request.put("messageVersion", messageVersion);
        request.putOpt("sdkTransId", record.getSdkTransId());
        request.put("interactionCounter", "01");
        request.put("authenticationValue", AuthenticationValues.forOutcome(authenticated));
        request.put("transStatus", authenticated ? TRANS_STATUS_AUTHENTICATED : TRANS_STATUS_NOT_AUTHENTICATED);
        request.put("threeDsServerTransId", record.getThreeDSServerTransId());
        return request;
    }

    public JSONObject buildResultsResponse(TransactionRecord record) {
        JSONObject response = new JSONObject();
        response.put("dsTransId", record.getDsTransId());
        response.put("messageType", "RRes");
        response.put("threeDsServerTransId", record.getThreeDSServerTransId());
        response.put("acsTransId", record.getAcsTransId());
        response.putOpt("sdkTransId", record.getSdkTransId());
        response.put("resultsStatus", RESULTS_STATUS_RECEIVED);
        response.put("messageVersion", MESSAGE_VERSION);
        return response;
    }

    /**
     * Final outcome of a transaction, or empty when no RReq has been received yet.
     */
    public Optional<JSONObject> finalResult(String threeDSServerTransId) throws TransactionNotFoundException {
        TransactionRecord record = transactionStore.get(threeDSServerTransId)
            .orElseThrow(() -> new TransactionNotFoundException(threeDSServerTransId));
        JSONObject resultsRequest = record.getResultsRequest();
        if (resultsRequest == null) {
            return Optional.empty();
        }
        JSONObject response = new JSONObject();
        response.put("eci", resultsRequest.optString("eci"));
        response.put("authenticationValue", resultsRequest.optString("authenticationValue"));
        response.put("threeDsServerTransId", threeDSServerTransId);
        response.put("resultsResponse", buildResultsResponse(record));
        response.put("resultsRequest", resultsRequest);
        response.put("transStatus", resultsRequest.optString("transStatus"));
        return Optional.of(response);
    }
}
