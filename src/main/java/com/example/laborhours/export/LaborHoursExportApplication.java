package com.example.laborhours.export;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication
@EnableCaching
public class LaborHoursExportApplication {

    public static void main(String[] args) {
        SpringApplication.run(LaborHoursExportApplication.class, args);
    }
}
