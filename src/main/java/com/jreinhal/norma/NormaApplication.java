package com.jreinhal.norma;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class NormaApplication {
    public static void main(String[] args) {
        SpringApplication.run(NormaApplication.class, args);
    }
}
