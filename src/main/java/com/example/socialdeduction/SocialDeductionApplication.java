package com.example.socialdeduction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class SocialDeductionApplication {

    public static void main(String[] args) {
        SpringApplication.run(SocialDeductionApplication.class, args);
    }
}
