package com.chatwave;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatWaveApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatWaveApplication.class, args);
    }
}
