package com.lynkvertx.tbce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * TBCE - Trapeze Bracket Check Engine
 * Main application entry point
 */
@SpringBootApplication
public class TbceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TbceApplication.class, args);
    }
}
