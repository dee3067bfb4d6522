package com.example.pointledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PointLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PointLedgerApplication.class, args);
    }
}
