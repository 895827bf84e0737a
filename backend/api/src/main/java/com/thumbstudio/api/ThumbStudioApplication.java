package com.thumbstudio.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ThumbStudioApplication {

    public static void main(String[] args) {
        // text rendering only, no display
        System.setProperty("java.awt.headless", "true");
        SpringApplication.run(ThumbStudioApplication.class, args);
    }
}
