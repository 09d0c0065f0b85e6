package com.flagship.credit_ledger.ledger;

import com.flagship.credit_ledger.asset.AssetRegistry;
import com.flagship.credit_ledger.asset.AssetType;
import com.flagship.credit_ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds the configured asset types and opens a treasury account for every active asset.
 * Safe to run on every start and from several instances at once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerBootstrap implements ApplicationRunner {

    private final LedgerProperties properties;
    private final AssetRegistry assetRegistry;
    private final AccountStore accountStore;

    @Override
    public void run(ApplicationArguments args) {
        for (LedgerProperties.AssetSeed seed : properties.getAssets()) {
            assetRegistry.register(seed.getCode(), seed.getName(), seed.getDescription(), seed.isActive());
        }

        int treasuries = 0;
        for (AssetType assetType : assetRegistry.findAllActive()) {
            accountStore.resolveOrCreate(properties.getTreasuryUserId(), assetType.getCode(), Account.Kind.SYSTEM);
            treasuries++;
        }
        log.info("Ledger ready: {} active asset types, treasury owner {}", treasuries, properties.getTreasuryUserId());
    }
}
