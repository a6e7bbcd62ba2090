package com.len.courtqueue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class CourtQueueServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourtQueueServiceApplication.class, args);
    }

}
