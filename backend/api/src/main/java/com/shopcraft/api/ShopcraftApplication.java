package com.shopcraft.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ShopcraftApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShopcraftApplication.class, args);
    }
}
