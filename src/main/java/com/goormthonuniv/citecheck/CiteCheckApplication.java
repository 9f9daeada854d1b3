package com.goormthonuniv.citecheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class CiteCheckApplication {

    public static void main(String[] args) {
        SpringApplication.run(CiteCheckApplication.class, args);
    }
}
