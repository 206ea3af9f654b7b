package com.auctionvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AuctionVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuctionVaultApplication.class, args);
    }
}
