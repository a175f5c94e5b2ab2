package com.edge.aoi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AoiUploaderApplication {

    public static void main(String[] args) {
        SpringApplication.run(AoiUploaderApplication.class, args);
    }
}
