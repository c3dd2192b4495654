package com.example.sfera;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SferaApplication {

    public static void main(String[] args) {
        SpringApplication.run(SferaApplication.class, args);
    }
}
