package com.hockeyfeed.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HockeyFeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(HockeyFeedApplication.class, args);
    }
}
