package com.agenticImaging.protocolReview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProtocolReviewApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(ProtocolReviewApplication.class, args);
    }
}
