package sample.threedsecure.acs;

/**
 * Result of signing the ARes acsSignedContent. A fallback result carries a
 * fixed pre-signed JWT and the reason live signing was not possible.
 */
public final class AcsSignedContent {

    public enum Kind { SIGNED, FALLBACK }

    private final Kind kind;
    private final String jwt;
    private final String reason;

    private AcsSignedContent(Kind kind, String jwt, String reason) {
        this.kind = kind;
        this.jwt = jwt;
        this.reason = reason;
    }

    public static AcsSignedContent signed(String jwt) {
        return new AcsSignedContent(Kind.SIGNED, jwt, null);
    }

    public static AcsSignedContent fallback(String jwt, String reason) {
        return new AcsSignedContent(Kind.FALLBACK, jwt, reason);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isFallback() {
        return kind == Kind.FALLBACK;
    }

    public String getJwt() {
        return jwt;
    }

    /** Null unless this is a fallback. */
    public String getReason() {
        return reason;
    }
}
