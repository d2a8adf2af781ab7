package com.example.tubefetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TubeFetchApplication {
    private static final Logger logger = LoggerFactory.getLogger(
            TubeFetchApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TubeFetchApplication.class, args);
        logger.info("Application started");
    }
}
