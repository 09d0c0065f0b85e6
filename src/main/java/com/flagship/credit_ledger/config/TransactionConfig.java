package com.flagship.credit_ledger.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Programmatic transaction templates for the ledger write path.
 *
 * The posting template wraps lock acquisition, the balance check and the journal write.
 * Its timeout is the configured lock timeout, so a blocked lock or a slow commit
 * rolls the unit back instead of hanging the request thread.
 */
@Configuration
@Slf4j
public class TransactionConfig {

    @Bean(name = "postingTransactionTemplate")
    @Primary
    public TransactionTemplate postingTransactionTemplate(PlatformTransactionManager transactionManager,
                                                          LedgerProperties properties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        template.setTimeout(timeoutSeconds(properties));

        log.info("Posting transactions: READ_COMMITTED, timeout={}s", template.getTimeout());
        return template;
    }

    /**
     * Account creation runs in its own short transaction so a duplicate-key race
     * never poisons the caller's unit of work.
     */
    @Bean(name = "accountCreationTransactionTemplate")
    public TransactionTemplate accountCreationTransactionTemplate(PlatformTransactionManager transactionManager,
                                                                  LedgerProperties properties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setTimeout(timeoutSeconds(properties));
        return template;
    }

    private static int timeoutSeconds(LedgerProperties properties) {
        long seconds = properties.getLockTimeout().toSeconds();
        return (int) Math.max(1, seconds);
    }
}
