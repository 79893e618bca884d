package com.flagship.celebration_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CelebrationLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CelebrationLedgerApplication.class, args);
    }
}
