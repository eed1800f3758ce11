package com.adinsight.segment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SegmentAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(SegmentAnalysisApplication.class, args);
    }
}
