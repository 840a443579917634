package com.companya.scd;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ScdPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScdPipelineApplication.class, args);
    }
}
