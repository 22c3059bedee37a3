package sample.threedsecure;

import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Runtime settings of the mock server, bound from application.properties.
 */
public class ServerSettings {

    private final String host;
    private final int port;
    private final long transactionTtlSeconds;
    private final String transactionKeyPrefix;
    private final String defaultRedirectUrl;
    private final String acsCertificatePath;
    private final String acsPrivateKeyPath;

    public ServerSettings(String host, int port, long transactionTtlSeconds, String transactionKeyPrefix,
                          String defaultRedirectUrl, String acsCertificatePath, String acsPrivateKeyPath) {
        this.host = host;
        this.port = port;
        this.transactionTtlSeconds = transactionTtlSeconds;
        this.transactionKeyPrefix = transactionKeyPrefix;
        this.defaultRedirectUrl = defaultRedirectUrl;
        this.acsCertificatePath = acsCertificatePath;
        this.acsPrivateKeyPath = acsPrivateKeyPath;
    }

    /**
     * @throws IllegalStateException naming the first invalid setting
     */
    public ServerSettings validate() {
        if (StringUtils.isBlank(host)) {
            throw new IllegalStateException("Server host must not be empty");
        }
        if (port <= 0) {
            throw new IllegalStateException("Server port must be greater than 0");
        }
        if (transactionTtlSeconds <= 0) {
            throw new IllegalStateException("Transaction TTL must be greater than 0");
        }
        if (StringUtils.isBlank(transactionKeyPrefix)) {
            throw new IllegalStateException("Transaction key prefix must not be empty");
        }
        if (StringUtils.isBlank(defaultRedirectUrl)) {
            throw new IllegalStateException("Default redirect URL must not be empty");
        }
        return this;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    /** Base URL used to build acsURL values, e.g. http://127.0.0.1:8080. */
    public String getServerUrl() {
        return "http://" + host + ":" + port;
    }

    public Duration getTransactionTtl() {
        return Duration.ofSeconds(transactionTtlSeconds);
    }

    public String getTransactionKeyPrefix() {
        return transactionKeyPrefix;
    }

    public String getDefaultRedirectUrl() {
        return defaultRedirectUrl;
    }

    public Path getAcsCertificatePath() {
        return Paths.get(acsCertificatePath);
    }

    public Path getAcsPrivateKeyPath() {
        return Paths.get(acsPrivateKeyPath);
    }
}
