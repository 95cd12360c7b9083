package com.docindex.main;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication(scanBasePackages = "com.docindex")
public class DocIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocIndexApplication.class, args);
    }
}
