package com.supergrid.trader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SuperGridApplication {

    public static void main(String[] args) {
        SpringApplication.run(SuperGridApplication.class, args);
    }
}
