package com.paramvault.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ParamVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(ParamVaultApplication.class, args);
    }
}
