package com.reviewmate.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReviewMateApplication {

    public static void main(String[] args) {
        // timestamps are stored and rendered in UTC regardless of host settings
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
        SpringApplication.run(ReviewMateApplication.class, args);
    }
}
