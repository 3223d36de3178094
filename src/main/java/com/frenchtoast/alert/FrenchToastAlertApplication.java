package com.frenchtoast.alert;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FrenchToastAlertApplication {
    public static void main(String[] args) {
        SpringApplication.run(FrenchToastAlertApplication.class, args);
    }
}
