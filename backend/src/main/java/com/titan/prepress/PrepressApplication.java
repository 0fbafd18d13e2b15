package com.titan.prepress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PrepressApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrepressApplication.class, args);
    }
}
