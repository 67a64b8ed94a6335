package com.csd.vulnscan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VulnScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(VulnScanApplication.class, args);
    }
}
