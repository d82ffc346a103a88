package com.restaurantguide.search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EstablishmentSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(EstablishmentSearchApplication.class, args);
    }
}
