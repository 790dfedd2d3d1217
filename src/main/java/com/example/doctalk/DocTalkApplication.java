package com.example.doctalk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocTalkApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocTalkApplication.class, args);
    }
}
