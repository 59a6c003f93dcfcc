package com.dbbaskette.codeguardian;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CodeGuardianApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeGuardianApplication.class, args);
    }
}
