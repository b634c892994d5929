package com.netai.insights;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NetAiInsightsApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetAiInsightsApplication.class, args);
    }
}
