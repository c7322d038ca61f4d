package com.example.changeguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChangelogGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChangelogGuardApplication.class, args);
    }
}
