package com.herzen.gradepipe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GradePipelineApplication {
    public static void main(String[] args) {
        SpringApplication.run(GradePipelineApplication.class, args);
    }
}
