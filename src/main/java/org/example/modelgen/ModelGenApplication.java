package org.example.modelgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ModelGenApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelGenApplication.class, args);
    }
}
