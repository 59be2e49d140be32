package com.streamfirst.lazymint.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LazyMintApplication {

    public static void main(String[] args) {
        SpringApplication.run(LazyMintApplication.class, args);
    }
}
