package com.acme.corna;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CornaApplication {
    public static void main(String[] args) {
        SpringApplication.run(CornaApplication.class, args);
    }
}
