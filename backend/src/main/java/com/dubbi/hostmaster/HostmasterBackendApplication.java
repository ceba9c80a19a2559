package com.dubbi.hostmaster;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HostmasterBackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(HostmasterBackendApplication.class, args);
    }
}
