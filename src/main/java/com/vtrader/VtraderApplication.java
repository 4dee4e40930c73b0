package com.vtrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VtraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(VtraderApplication.class, args);
    }
}
