package sample.threedsecure;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import sample.threedsecure.acs.AcsSignedContentSigner;
import sample.threedsecure.ecdh.EphemeralKeyGenerator;
import sample.threedsecure.ecdh.KeyDerivationService;
import sample.threedsecure.jwe.ChallengeMessageCipher;
import sample.threedsecure.jwe.PlatformDetector;
import sample.threedsecure.server.TransactionResultsService;
import sample.threedsecure.transaction.InMemoryTransactionStore;
import sample.threedsecure.transaction.TransactionStore;

import java.util.logging.Level;
import java.util.logging.Logger;

@Configuration
public class ThreeDSConfiguration {

    @Value("${server.host:127.0.0.1}")
    private String host;

    @Value("${server.port:8080}")
    private int port;

    @Value("${threeds.transaction.ttl-seconds:1200}")
    private long transactionTtlSeconds;

    @Value("${threeds.transaction.key-prefix:3ds_transaction}")
    private String transactionKeyPrefix;

    @Value("${threeds.redirect.default-url:https://juspay.api.in.end}")
    private String defaultRedirectUrl;

    @Value("${threeds.acs.certificate-path:certs/acs-cert.pem}")
    private String acsCertificatePath;

    @Value("${threeds.acs.private-key-path:certs/acs-private-key.pem}")
    private String acsPrivateKeyPath;

    @Bean
    public ServerSettings serverSettings() {
        ServerSettings settings = new ServerSettings(host, port, transactionTtlSeconds, transactionKeyPrefix,
            defaultRedirectUrl, acsCertificatePath, acsPrivateKeyPath).validate();
        Logger.getGlobal().log(Level.INFO, "ThreeDSConfiguration:serverSettings server URL {0}",
            settings.getServerUrl());
        return settings;
    }

    @Bean
    public TransactionStore transactionStore(ServerSettings settings) {
        return new InMemoryTransactionStore(settings.getTransactionKeyPrefix());
    }

    @Bean
    public EphemeralKeyGenerator ephemeralKeyGenerator() {
        return new EphemeralKeyGenerator();
    }

    @Bean
    public ChallengeMessageCipher challengeMessageCipher() {
        return new ChallengeMessageCipher(new KeyDerivationService(), new PlatformDetector());
    }

    @Bean
    public AcsSignedContentSigner acsSignedContentSigner(ServerSettings settings) {
        AcsSignedContentSigner signer =
            AcsSignedContentSigner.fromFiles(settings.getAcsCertificatePath(), settings.getAcsPrivateKeyPath());
        Logger.getGlobal().log(Level.INFO, "ThreeDSConfiguration:acsSignedContentSigner signing available: {0}",
            signer.isSigningAvailable());
        return signer;
    }

    @Bean
    public TransactionResultsService transactionResultsService(TransactionStore transactionStore) {
        return new TransactionResultsService(transactionStore);
    }
}
