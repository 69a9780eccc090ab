package com.flagship.leave_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LeaveLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeaveLedgerApplication.class, args);
    }
}
