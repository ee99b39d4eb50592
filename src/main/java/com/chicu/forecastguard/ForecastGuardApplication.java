package com.chicu.forecastguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.forecastguard")
public class ForecastGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForecastGuardApplication.class, args);
    }
}
