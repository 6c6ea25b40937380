package com.streamfirst.history.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(HistoryRetrievalProperties.class)
public class HistoryRetrievalApplication {

    public static void main(String[] args) {
        SpringApplication.run(HistoryRetrievalApplication.class, args);
    }
}
