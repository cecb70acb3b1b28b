package com.dpp.audit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "audit")
public class AuditProperties {

    private ChainProperties chain = new ChainProperties();
    private AnchorProperties anchor = new AnchorProperties();
    private SigningProperties signing = new SigningProperties();
    private TsaProperties tsa = new TsaProperties();

    @Data
    public static class ChainProperties {
        /** {@code advisory} (PostgreSQL) or {@code in-process}. */
        private String lockMode = "advisory";
        private Duration lockWait = Duration.ofSeconds(5);
    }

    @Data
    public static class AnchorProperties {
        private Integer batchSize = 1000;
        private Integer maxBatchesPerRun = 100;
    }

    @Data
    public static class SigningProperties {
        /** Base64 PKCS#8 Ed25519 private key. */
        private String privateKey;
        /** Base64 X.509 Ed25519 public key. */
        private String publicKey;
        private String keyId;
    }

    @Data
    public static class TsaProperties {
        /** RFC 3161 endpoint; timestamping is skipped when blank. */
        private String url;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }
}
