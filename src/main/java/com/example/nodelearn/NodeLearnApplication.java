package com.example.nodelearn;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NodeLearnApplication {

    public static void main(String[] args) {
        SpringApplication.run(NodeLearnApplication.class, args);
    }
}
