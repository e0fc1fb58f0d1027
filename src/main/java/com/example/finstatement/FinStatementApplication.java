package com.example.finstatement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinStatementApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinStatementApplication.class, args);
    }
}
