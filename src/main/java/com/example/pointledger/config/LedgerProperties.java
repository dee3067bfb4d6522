package com.example.pointledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /**
     * How far ahead upcoming expirations are reported.
     */
    private Duration upcomingExpirationWindow = Duration.ofDays(30);

    private TransferRequest transferRequest = new TransferRequest();

    private Grant grant = new Grant();

    @Data
    public static class TransferRequest {

        /**
         * Time a PENDING request waits for the recipient before it can no longer be approved.
         */
        private Duration defaultTtl = Duration.ofHours(24);
    }

    @Data
    public static class Grant {

        /**
         * Validity applied to grants that carry no explicit expiresAt.
         * Unset means such grants never expire.
         */
        private Duration defaultValidity;
    }
}
