package com.dcarunner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DcaRunnerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DcaRunnerApplication.class, args);
    }
}
