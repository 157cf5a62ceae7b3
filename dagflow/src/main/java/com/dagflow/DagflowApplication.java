package com.dagflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DagflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(DagflowApplication.class, args);
    }
}
