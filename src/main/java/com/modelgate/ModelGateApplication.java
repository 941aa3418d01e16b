package com.modelgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ModelGate Server Application
 *
 * API key gateway in front of the upstream model listing, with a
 * lease-protected background refresh of the local catalog mirror.
 */
@SpringBootApplication
@EnableR2dbcRepositories
@EnableScheduling
@ConfigurationPropertiesScan
public class ModelGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelGateApplication.class, args);
    }

}
