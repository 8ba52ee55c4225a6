package com.migranet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MigraNetApplication {

    public static void main(String[] args) {
        SpringApplication.run(MigraNetApplication.class, args);
    }
}
