package com.vidnyan.swivel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Swivel - staged validation and self-healing for generated Swing programs.
 */
@SpringBootApplication
public class SwivelApplication {

    public static void main(String[] args) {
        SpringApplication.run(SwivelApplication.class, args);
    }
}
