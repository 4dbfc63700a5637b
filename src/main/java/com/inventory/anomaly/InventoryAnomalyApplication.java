package com.inventory.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class InventoryAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryAnomalyApplication.class, args);
    }
}
