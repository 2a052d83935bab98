package com.jay.forecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CompanyForecastApplication {
    public static void main(String[] args) {
        SpringApplication.run(CompanyForecastApplication.class, args);
    }
}
