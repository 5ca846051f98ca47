package io.marketminer.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketMinerApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketMinerApiApplication.class, args);
    }
}
