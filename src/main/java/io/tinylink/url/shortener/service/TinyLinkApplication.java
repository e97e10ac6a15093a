package io.tinylink.url.shortener.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TinyLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(TinyLinkApplication.class, args);
    }
}
