package com.textworld.adventureservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * adventure-service 启动入口。
 */
@SpringBootApplication
public class AdventureServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdventureServiceApplication.class, args);
    }
}
