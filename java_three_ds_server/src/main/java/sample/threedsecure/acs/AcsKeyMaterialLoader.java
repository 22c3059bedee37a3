package sample.threedsecure.acs;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import sample.threedsecure.CertificateLoadException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.PrivateKey;
import java.security.Security;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads the ACS signing certificate and RSA private key from PEM files.
 * The key may be PKCS#1 ("RSA PRIVATE KEY") or PKCS#8 ("PRIVATE KEY").
 */
public class AcsKeyMaterialLoader {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    public static AcsKeyMaterial load(Path certificatePath, Path privateKeyPath) throws CertificateLoadException {
        X509Certificate certificate = readCertificate(certificatePath);
        PrivateKey privateKey = readPrivateKey(privateKeyPath);

        if (!(certificate.getPublicKey() instanceof RSAPublicKey) || !(privateKey instanceof RSAPrivateKey)) {
            throw new CertificateLoadException("ACS signing material must be RSA");
        }
        RSAPublicKey publicKey = (RSAPublicKey) certificate.getPublicKey();
        if (!publicKey.getModulus().equals(((RSAPrivateKey) privateKey).getModulus())) {
            throw new CertificateLoadException("Private key " + privateKeyPath
                + " does not match certificate " + certificatePath);
        }

        Logger.getGlobal().log(Level.INFO, "AcsKeyMaterialLoader:load loaded ACS certificate {0}",
            certificate.getSubjectX500Principal());
        return new AcsKeyMaterial(certificate, privateKey);
    }

    private static X509Certificate readCertificate(Path path) throws CertificateLoadException {
        Object object = readPemObject(path);
        if (!(object instanceof X509CertificateHolder)) {
            throw new CertificateLoadException("No X.509 certificate found in " + path);
        }
        try {
            return new JcaX509CertificateConverter()
                .setProvider("BC")
                .getCertificate((X509CertificateHolder) object);
        } catch (CertificateException e) {
            throw new CertificateLoadException("Invalid certificate in " + path, e);
        }
    }

    private static PrivateKey readPrivateKey(Path path) throws CertificateLoadException {
        Object object = readPemObject(path);
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider("BC");
        try {
            if (object instanceof PEMKeyPair) {
                // PKCS#1
                return converter.getKeyPair((PEMKeyPair) object).getPrivate();
            } else if (object instanceof PrivateKeyInfo) {
                // PKCS#8
                return converter.getPrivateKey((PrivateKeyInfo) object);
            }
        } catch (IOException e) {
            throw new CertificateLoadException("Invalid private key in " + path, e);
        }
        throw new CertificateLoadException("No RSA private key found in " + path);
    }

    private static Object readPemObject(Path path) throws CertificateLoadException {
        if (!Files.isReadable(path)) {
            throw new CertificateLoadException("File not found or not readable: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.US_ASCII);
             PEMParser pemParser = new PEMParser(reader)) {
            Object object = pemParser.readObject();
            if (object == null) {
                throw new CertificateLoadException("No PEM content in " + path);
            }
            return object;
        } catch (IOException e) {
            throw new CertificateLoadException("Unable to read PEM file " + path, e);
        }
    }
}
