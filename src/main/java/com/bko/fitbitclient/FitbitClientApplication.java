package com.bko.fitbitclient;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FitbitClientApplication {

    public static void main(String[] args) {
        SpringApplication.run(FitbitClientApplication.class, args);
    }
}
