package com.bsl.bankcode;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BankRetrievalApplication {
    public static void main(String[] args) {
        SpringApplication.run(BankRetrievalApplication.class, args);
    }
}
