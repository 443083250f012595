package com.cratedownloads;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CrateDownloadsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrateDownloadsApplication.class, args);
    }
}
