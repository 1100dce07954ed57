package com.healthecon.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.healthecon")
@EntityScan("com.healthecon.data.entity")
@EnableJpaRepositories("com.healthecon.data.repository")
public class HealthEconApiApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(HealthEconApiApplication.class, args);
    }
}
