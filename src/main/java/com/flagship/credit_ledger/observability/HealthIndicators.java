package com.flagship.credit_ledger.observability;

import com.flagship.credit_ledger.ledger.LedgerJournal;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;

/**
 * Custom health indicators for the credit ledger.
 */
public class HealthIndicators {

    /**
     * DOWN when the signed sum of all journal legs for any asset type is not zero.
     * A non-zero sum means an unbalanced write reached the journal.
     */
    @Component("ledgerInvariant")
    public static class LedgerInvariantHealthIndicator implements HealthIndicator {

        private final LedgerJournal ledgerJournal;

        public LedgerInvariantHealthIndicator(LedgerJournal ledgerJournal) {
            this.ledgerJournal = ledgerJournal;
        }

        @Override
        public Health health() {
            try {
                Map<String, BigDecimal> totals = ledgerJournal.totalByAsset();
                Map<String, String> unbalanced = new TreeMap<>();
                totals.forEach((asset, total) -> {
                    if (total.signum() != 0) {
                        unbalanced.put(asset, total.toPlainString());
                    }
                });

                Health.Builder builder = unbalanced.isEmpty() ? Health.up() : Health.down();
                builder.withDetail("assetsChecked", totals.size());
                if (!unbalanced.isEmpty()) {
                    builder.withDetail("unbalancedAssets", unbalanced);
                }
                return builder.build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
