package com.aec.AdminDrive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdminDriveApplication {
    public static void main(String[] args) {
        SpringApplication.run(AdminDriveApplication.class, args);
    }
}
