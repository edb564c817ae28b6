package com.trackradar.radar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrackRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrackRadarApplication.class, args);
    }
}
