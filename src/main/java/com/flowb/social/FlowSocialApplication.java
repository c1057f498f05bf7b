package com.flowb.social;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowSocialApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowSocialApplication.class, args);
    }
}
