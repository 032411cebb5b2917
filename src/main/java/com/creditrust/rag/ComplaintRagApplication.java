package com.creditrust.rag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ComplaintRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComplaintRagApplication.class, args);
    }
}
