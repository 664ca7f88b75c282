package com.williamcallahan.lawlens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LawLensApplication {

    public static void main(String[] args) {
        SpringApplication.run(LawLensApplication.class, args);
    }
}
