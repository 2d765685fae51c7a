package com.example.manifestextract;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ManifestExtractApplication {

    public static void main(String[] args) {
        SpringApplication.run(ManifestExtractApplication.class, args);
    }
}
