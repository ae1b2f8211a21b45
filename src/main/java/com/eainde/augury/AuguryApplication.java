package com.eainde.augury;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AuguryApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuguryApplication.class, args);
    }
}
