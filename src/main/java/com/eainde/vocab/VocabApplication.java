package com.eainde.vocab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VocabApplication {

    public static void main(String[] args) {
        SpringApplication.run(VocabApplication.class, args);
    }
}
