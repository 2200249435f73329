package com.guno.bulkimport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot Application
 */
@SpringBootApplication
public class BulkImportApplication {

    public static void main(String[] args) {
        SpringApplication.run(BulkImportApplication.class, args);
    }
}
