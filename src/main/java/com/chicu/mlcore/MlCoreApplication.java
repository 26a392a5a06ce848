package com.chicu.mlcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.mlcore")
public class MlCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(MlCoreApplication.class, args);
    }
}
