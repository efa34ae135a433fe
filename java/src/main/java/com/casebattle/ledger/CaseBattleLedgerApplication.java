package com.casebattle.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CaseBattleLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaseBattleLedgerApplication.class, args);
    }
}
