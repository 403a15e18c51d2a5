package com.example.carerota;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CareRotaApplication {

    public static void main(String[] args) {
        SpringApplication.run(CareRotaApplication.class, args);
    }
}
