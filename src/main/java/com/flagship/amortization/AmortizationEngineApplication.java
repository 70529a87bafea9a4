package com.flagship.amortization;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AmortizationEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AmortizationEngineApplication.class, args);
    }
}
