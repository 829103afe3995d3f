package com.setupbrain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SetupBrainApplication {

    public static void main(String[] args) {
        SpringApplication.run(SetupBrainApplication.class, args);
    }
}
