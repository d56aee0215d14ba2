package com.linlay.reasoningrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ReasoningRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReasoningRelayApplication.class, args);
    }
}
