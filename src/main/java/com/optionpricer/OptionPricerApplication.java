package com.optionpricer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptionPricerApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptionPricerApplication.class, args);
    }
}
