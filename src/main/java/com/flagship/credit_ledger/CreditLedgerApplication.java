package com.flagship.credit_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CreditLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreditLedgerApplication.class, args);
    }
}
