package com.myorg.normcontrol;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class NormControlApplication {

    public static void main(String[] args) {
        SpringApplication.run(NormControlApplication.class, args);
    }
}
