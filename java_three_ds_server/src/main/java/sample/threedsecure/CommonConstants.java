package sample.threedsecure;

/*
 * Constants shared by the 3DS server endpoints and the mock ACS endpoints.
 */
public interface CommonConstants {

    public static final String THREE_DS_VERSION_API = "/3ds/version";
    public static final String THREE_DS_AUTHENTICATE_API = "/3ds/authenticate";
    public static final String THREE_DS_RESULTS_API = "/3ds/results";
    public static final String THREE_DS_FINAL_API = "/3ds/final";
    public static final String HEALTH_API = "/health";

    public static final String ACS_CHALLENGE_API = "/challenge";
    public static final String ACS_TRIGGER_OTP_API = "/processor/mock/acs/trigger-otp";
    public static final String ACS_VERIFY_OTP_API = "/processor/mock/acs/verify-otp";

    public static final String MESSAGE_VERSION = "2.2.0";

}
