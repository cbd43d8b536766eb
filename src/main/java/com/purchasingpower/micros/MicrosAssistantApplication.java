package com.purchasingpower.micros;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MicrosAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(MicrosAssistantApplication.class, args);
    }
}
