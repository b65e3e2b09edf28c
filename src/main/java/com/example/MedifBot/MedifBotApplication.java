package com.example.MedifBot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MedifBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(MedifBotApplication.class, args);
    }
}
