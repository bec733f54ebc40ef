package com.nosota.bankrec;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BankRecApplication {
    public static void main(String[] args) {
        SpringApplication.run(BankRecApplication.class, args);
    }
}
