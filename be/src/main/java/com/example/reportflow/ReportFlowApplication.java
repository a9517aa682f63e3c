package com.example.reportflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReportFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportFlowApplication.class, args);
    }
}
