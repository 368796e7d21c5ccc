package com.alertaggregator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AlertAggregatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertAggregatorApplication.class, args);
    }
}
