package sample.threedsecure.acs;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;

/**
 * The ACS signing certificate and its matching RSA private key.
 */
public final class AcsKeyMaterial {

    private final X509Certificate certificate;
    private final PrivateKey privateKey;

    public AcsKeyMaterial(X509Certificate certificate, PrivateKey privateKey) {
        this.certificate = certificate;
        this.privateKey = privateKey;
    }

    public X509Certificate getCertificate() {
        return certificate;
    }

    public PrivateKey getPrivateKey() {
        return privateKey;
    }
}
