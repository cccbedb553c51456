package com.trustplatform.trust;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrustServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrustServiceApplication.class, args);
    }
}
