package sample.threedsecure;

public interface ServiceConstants extends CommonConstants {

    public static final String ACS_OPERATOR_ID = "MOCK_ACS";
    public static final String ACS_REFERENCE_NUMBER = "issuer1";
    // exemption flow, threeDSRequestorChallengeInd 05
    public static final String EXEMPTION_ACS_OPERATOR_ID = "MOCK_ACS_NEW";
    public static final String EXEMPTION_ACS_REFERENCE_NUMBER = "issuer2";
    public static final String DS_REFERENCE_NUMBER = "MOCK_DS";

    public static final String THREE_DS_SERVER_REF_NUMBER = "3DS_LOA_SER_JTPL_020200_00841";
    public static final String THREE_DS_SERVER_OPERATOR_ID = "10073246";
    public static final String THREE_DS_SERVER_RESULTS_URL = "https://visa.3ds.certification.juspay.in/3ds/results";

    public static final String DEVICE_CHANNEL_APP = "01";

    public static final String CHALLENGE_IND_MANDATED = "04";
    public static final String CHALLENGE_IND_NO_CHALLENGE = "05";
    public static final String CHALLENGE_CARD_SUFFIX = "4001";

    public static final String VALID_OTP = "1234";

    public static final String TRANS_STATUS_AUTHENTICATED = "Y";
    public static final String TRANS_STATUS_NOT_AUTHENTICATED = "N";
    public static final String TRANS_STATUS_CHALLENGE = "C";
    public static final String TRANS_STATUS_UNAVAILABLE = "U";

    public static final String ECI_FRICTIONLESS = "05";
    public static final String ECI_CHALLENGE_SUCCESS = "02";
    public static final String ECI_CHALLENGE_FAILED = "07";

    // placeholder carried in every ARes until the RReq supplies a real CAVV
    public static final String ARES_AUTHENTICATION_VALUE = "QWErty123+/ABCD5678ghijklmn==";

    public static final String RESULTS_STATUS_RECEIVED = "01";

}
