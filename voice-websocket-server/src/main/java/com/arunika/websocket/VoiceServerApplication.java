package com.arunika.websocket;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VoiceServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceServerApplication.class, args);
    }
}
