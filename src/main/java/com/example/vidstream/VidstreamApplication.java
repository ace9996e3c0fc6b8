package com.example.vidstream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class VidstreamApplication {
    private static final Logger logger = LoggerFactory.getLogger(
            VidstreamApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(VidstreamApplication.class, args);
        logger.info("Application started");
    }
}
