package com.example.rfp.responderservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RfpResponderApplication {

    public static void main(String[] args) {
        SpringApplication.run(RfpResponderApplication.class, args);
    }
}
