package com.flagship.collateral_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CollateralEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollateralEngineApplication.class, args);
    }
}
