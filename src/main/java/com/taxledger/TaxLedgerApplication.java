package com.taxledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaxLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaxLedgerApplication.class, args);
    }
}
