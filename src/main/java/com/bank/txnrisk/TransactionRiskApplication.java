package com.bank.txnrisk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TransactionRiskApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransactionRiskApplication.class, args);
    }
}
