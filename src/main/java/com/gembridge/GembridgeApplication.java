package com.gembridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Gembridge - OpenAI-compatible gateway in front of Gemini Code Assist.
 */
@SpringBootApplication
public class GembridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(GembridgeApplication.class, args);
    }
}
