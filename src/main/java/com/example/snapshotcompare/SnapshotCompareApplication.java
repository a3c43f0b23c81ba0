package com.example.snapshotcompare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SnapshotCompareApplication {
    public static void main(String[] args) {
        SpringApplication.run(SnapshotCompareApplication.class, args);
    }
}
