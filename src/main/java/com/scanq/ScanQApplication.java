package com.scanq;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScanQApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScanQApplication.class, args);
    }
}
