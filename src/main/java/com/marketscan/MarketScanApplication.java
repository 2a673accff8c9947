package com.marketscan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketScanApplication.class, args);
    }
}
