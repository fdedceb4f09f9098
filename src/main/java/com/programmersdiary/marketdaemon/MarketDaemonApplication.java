package com.programmersdiary.marketdaemon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MarketDaemonApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketDaemonApplication.class, args);
    }
}
