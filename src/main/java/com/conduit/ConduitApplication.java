package com.conduit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Conduit - OpenAI-compatible gateway in front of OpenAI, Anthropic, Google and Coze.
 */
@SpringBootApplication
public class ConduitApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConduitApplication.class, args);
    }
}
