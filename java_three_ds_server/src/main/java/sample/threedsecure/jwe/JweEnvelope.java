package sample.threedsecure.jwe;

import sample.threedsecure.MalformedEnvelopeException;
import sample.threedsecure.ecdh.ECDHCryptoUtils;

import java.nio.charset.StandardCharsets;

/**
 * Five-part compact JWE: header, (empty) encrypted key, IV, ciphertext, tag.
 * The header is kept in its received encoding because those exact ASCII
 * bytes are the additional authenticated data.
 */
public final class JweEnvelope {

    private final JweHeader header;
    private final String encodedHeader;
    private final byte[] iv;
    private final byte[] ciphertext;
    private final byte[] tag;

    public JweEnvelope(JweHeader header, byte[] iv, byte[] ciphertext, byte[] tag) {
        this(header, header.encode(), iv, ciphertext, tag);
    }

    private JweEnvelope(JweHeader header, String encodedHeader, byte[] iv, byte[] ciphertext, byte[] tag) {
        this.header = header;
        this.encodedHeader = encodedHeader;
        this.iv = iv.clone();
        this.ciphertext = ciphertext.clone();
        this.tag = tag.clone();
    }

    public JweHeader getHeader() {
        return header;
    }

    public String getEncodedHeader() {
        return encodedHeader;
    }

    public byte[] getIv() {
        return iv.clone();
    }

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }

    public byte[] getTag() {
        return tag.clone();
    }

    public byte[] getAdditionalAuthenticatedData() {
        return encodedHeader.getBytes(StandardCharsets.US_ASCII);
    }

    public String serialize() {
        return encodedHeader
            + ".."
            + ECDHCryptoUtils.base64UrlEncode(iv) + "."
            + ECDHCryptoUtils.base64UrlEncode(ciphertext) + "."
            + ECDHCryptoUtils.base64UrlEncode(tag);
    }

    public static JweEnvelope parse(String compact) throws MalformedEnvelopeException {
        if (compact == null) {
            throw new MalformedEnvelopeException("JWE is missing");
        }
        String[] parts = compact.trim().split("\\.", -1);
        if (parts.length != 5) {
            throw new MalformedEnvelopeException("Invalid JWE format - expected 5 parts, got " + parts.length);
        }
        if (!parts[1].isEmpty()) {
            throw new MalformedEnvelopeException("Encrypted key must be empty for direct key agreement");
        }
        JweHeader header = JweHeader.decode(parts[0]);
        try {
            return new JweEnvelope(header, parts[0],
                ECDHCryptoUtils.base64UrlDecode(parts[2]),
                ECDHCryptoUtils.base64UrlDecode(parts[3]),
                ECDHCryptoUtils.base64UrlDecode(parts[4]));
        } catch (IllegalArgumentException e) {
            throw new MalformedEnvelopeException("JWE segment is not base64url encoded", e);
        }
    }
}
