package org.example.simplifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SimplifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(SimplifierApplication.class, args);
    }
}
