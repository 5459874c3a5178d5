package com.demo.changefeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChangefeedExampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChangefeedExampleApplication.class, args);
    }
}
