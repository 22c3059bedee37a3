package sample.threedsecure.jwe;

/**
 * Which direction a content key serves, seen from the ACS. A128GCM keys use
 * a different half of the derived material per direction; A128CBC-HS256
 * keys use the full 32 bytes both ways.
 */
public enum KeyUsage {
    /** ACS to SDK (CRes). Bytes 16..31 for A128GCM. */
    ENCRYPT_HALF,
    /** SDK to ACS (CReq). Bytes 0..15 for A128GCM. */
    DECRYPT_HALF
}
