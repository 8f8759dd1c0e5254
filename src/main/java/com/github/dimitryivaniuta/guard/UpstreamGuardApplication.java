package com.github.dimitryivaniuta.guard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UpstreamGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(UpstreamGuardApplication.class, args);
    }
}
