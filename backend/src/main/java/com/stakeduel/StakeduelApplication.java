package com.stakeduel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StakeduelApplication {
    public static void main(String[] args) {
        SpringApplication.run(StakeduelApplication.class, args);
    }
}
