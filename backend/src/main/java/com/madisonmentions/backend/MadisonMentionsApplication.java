package com.madisonmentions.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MadisonMentionsApplication {

    public static void main(String[] args) {
        SpringApplication.run(MadisonMentionsApplication.class, args);
    }
}
