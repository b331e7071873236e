package com.flagship.loyalty_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LoyaltyLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoyaltyLedgerApplication.class, args);
    }
}
