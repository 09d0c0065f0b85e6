package com.flagship.credit_ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /**
     * Owner id of the per-asset treasury accounts.
     * Users may not transact under this id.
     */
    private String treasuryUserId = "SYSTEM_TREASURY";

    /**
     * Upper bound for one posting unit of work: lock acquisition, balance check and commit.
     * Exceeding it rolls the whole unit back and surfaces a retryable conflict.
     */
    private Duration lockTimeout = Duration.ofSeconds(5);

    private Amount amount = new Amount();

    private History history = new History();

    /**
     * Asset types registered at startup (insert-if-absent).
     */
    private List<AssetSeed> assets = new ArrayList<>();

    @Data
    public static class Amount {

        /**
         * Smallest accepted transaction amount (inclusive).
         */
        private BigDecimal min = new BigDecimal("0.01");

        /**
         * Largest accepted transaction amount (inclusive).
         */
        private BigDecimal max = new BigDecimal("1000000.00");
    }

    @Data
    public static class History {

        private int defaultLimit = 50;

        private int maxLimit = 100;
    }

    @Data
    public static class AssetSeed {

        private String code;

        private String name;

        private String description;

        private boolean active = true;
    }
}
