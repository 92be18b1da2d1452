package com.logflow.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


@SpringBootApplication
public class AnomalyApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnomalyApiApplication.class, args);
    }

}
