package com.example.corprisk;

import com.example.corprisk.config.RegistryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RegistryProperties.class)
public class CorpRiskApplication {

    public static void main(String[] args) {
        SpringApplication.run(CorpRiskApplication.class, args);
    }

}
